package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

@Schema(description = "Recommendation produced for a ticker.")
public record AnalysisDataDto(
		@JsonProperty("ticker") String ticker,
		@JsonProperty("style") String style,
		@Schema(description = "buy, hold or sell") @JsonProperty("action") String action,
		@Schema(description = "Equal to the composite score, in [0, 1].") @JsonProperty("confidence") double confidence,
		@JsonProperty("reason") String reason,
		@Schema(description = "llm or rule_based") @JsonProperty("source") String source,
		@JsonProperty("generatedAt") Instant generatedAt,
		@JsonProperty("compositeScore") double compositeScore,
		@JsonProperty("scoreDetails") List<ScoreComponentDto> scoreDetails
) {
}
