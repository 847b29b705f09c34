package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AnalysisMetadataDto(
		@JsonProperty("cacheHit") boolean cacheHit,
		@JsonProperty("states") List<String> states,
		@JsonProperty("processingTimeMs") long processingTimeMs
) {
}
