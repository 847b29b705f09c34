package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Standard agent response envelope. Exactly one of data and error is set.")
public record AnalysisResponseDto(
		@JsonProperty("agentType") String agentType,
		@JsonProperty("version") String version,
		@Schema(description = "success or error") @JsonProperty("status") String status,
		@JsonProperty("timestamp") Instant timestamp,
		@JsonProperty("data") AnalysisDataDto data,
		@JsonProperty("error") AnalysisErrorDto error,
		@JsonProperty("metadata") AnalysisMetadataDto metadata
) {
}
