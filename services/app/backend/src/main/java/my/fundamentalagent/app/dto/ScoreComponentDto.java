package my.fundamentalagent.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Contribution of one metric to the composite score.")
public record ScoreComponentDto(
		@JsonProperty("metric") String metric,
		@JsonProperty("label") String label,
		@JsonProperty("value") Double value,
		@JsonProperty("displayValue") String displayValue,
		@JsonProperty("subScore") Double subScore,
		@JsonProperty("baseWeight") double baseWeight,
		@JsonProperty("appliedWeight") double appliedWeight
) {
}
