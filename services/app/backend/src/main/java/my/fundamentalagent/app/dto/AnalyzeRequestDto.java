package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Request to analyse one ticker for an investor style.")
public record AnalyzeRequestDto(
		@Schema(description = "Ticker symbol, case-insensitive.", example = "AAPL")
		@JsonProperty("ticker") @NotBlank @Size(max = 20) String ticker,
		@Schema(description = "Investor style: growth, value, dividend or quality. Defaults to growth.", example = "growth")
		@JsonProperty("style") String style
) {
}
