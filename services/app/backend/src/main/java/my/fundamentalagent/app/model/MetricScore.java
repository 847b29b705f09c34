package my.fundamentalagent.app.model;

/**
 * One line of a score breakdown. {@code value} and {@code subScore} are null when the metric was
 * unavailable, in which case {@code appliedWeight} is zero.
 */
public record MetricScore(
		Metric metric,
		Double value,
		Double subScore,
		double baseWeight,
		double appliedWeight
) {
	public boolean available() {
		return value != null && subScore != null;
	}

	public double contribution() {
		return available() ? appliedWeight * subScore : 0.0d;
	}
}
