package my.fundamentalagent.app.model;

import java.util.Comparator;
import java.util.List;

public record Score(
		InvestorStyle style,
		double composite,
		List<MetricScore> components
) {
	public Score {
		if (style == null) {
			throw new IllegalArgumentException("Score requires a style");
		}
		if (!Double.isFinite(composite) || composite < 0.0d || composite > 1.0d) {
			throw new IllegalArgumentException("Composite score out of range: " + composite);
		}
		components = components == null ? List.of() : List.copyOf(components);
	}

	public List<MetricScore> availableComponents() {
		return components.stream().filter(MetricScore::available).toList();
	}

	/**
	 * Available components ordered by weighted contribution, largest first. Ties fall back to the
	 * base weight and then to vocabulary order so the ranking is stable.
	 */
	public List<MetricScore> rankedContributions() {
		return components.stream()
				.filter(MetricScore::available)
				.sorted(Comparator.comparingDouble(MetricScore::contribution).reversed()
						.thenComparing(Comparator.comparingDouble(MetricScore::baseWeight).reversed())
						.thenComparing(component -> component.metric().ordinal()))
				.toList();
	}
}
