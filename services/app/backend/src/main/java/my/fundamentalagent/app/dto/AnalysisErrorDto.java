package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error reported when an analysis could not be produced.")
public record AnalysisErrorDto(
		@Schema(description = "TICKER_NOT_FOUND, INSUFFICIENT_DATA, MODEL_ERROR or INTERNAL_ERROR")
		@JsonProperty("code") String code,
		@JsonProperty("message") String message,
		@JsonProperty("retryable") boolean retryable
) {
}
