package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.model.MetricScore;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a style-specific composite score from a snapshot. Pure: the same snapshot and style always
 * yield the same score.
 *
 * <p>Weight redistribution: when some of a style's metrics are unavailable, every available metric's
 * applied weight is its base weight divided by the sum of the available base weights, so applied
 * weights always sum to 1. Unavailable metrics stay in the breakdown with an applied weight of 0.
 */
public class ScoringEngine {
	private final Map<Metric, ScoringCurve> curves;

	public ScoringEngine() {
		this(ScoringDefaults.curves());
	}

	public ScoringEngine(Map<Metric, ScoringCurve> curves) {
		EnumMap<Metric, ScoringCurve> resolved = new EnumMap<>(Metric.class);
		resolved.putAll(ScoringDefaults.curves());
		if (curves != null) {
			resolved.putAll(curves);
		}
		for (InvestorStyle style : InvestorStyle.values()) {
			for (Metric metric : StyleWeights.forStyle(style).keySet()) {
				if (!resolved.containsKey(metric)) {
					throw new IllegalStateException("No scoring curve for " + metric + " (style " + style.value() + ")");
				}
			}
		}
		this.curves = Collections.unmodifiableMap(resolved);
	}

	public Score score(TickerSnapshot snapshot, InvestorStyle style) {
		if (snapshot == null) {
			throw new IllegalArgumentException("Snapshot is required");
		}
		if (style == null) {
			throw new IllegalArgumentException("Investor style is required");
		}
		Map<Metric, Double> metrics = MetricNormalizer.normalize(snapshot);
		Map<Metric, Double> weights = StyleWeights.forStyle(style);

		double availableWeight = 0.0d;
		for (Map.Entry<Metric, Double> entry : weights.entrySet()) {
			if (metrics.containsKey(entry.getKey())) {
				availableWeight += entry.getValue();
			}
		}
		if (availableWeight <= 0.0d) {
			throw new InsufficientDataException("No " + style.value() + " metrics available for " + snapshot.ticker());
		}

		List<MetricScore> components = new ArrayList<>();
		double composite = 0.0d;
		for (Map.Entry<Metric, Double> entry : weights.entrySet()) {
			Metric metric = entry.getKey();
			double baseWeight = entry.getValue();
			Double value = metrics.get(metric);
			if (value == null) {
				components.add(new MetricScore(metric, null, null, baseWeight, 0.0d));
				continue;
			}
			double subScore = subScore(metric, value);
			double appliedWeight = baseWeight / availableWeight;
			composite += appliedWeight * subScore;
			components.add(new MetricScore(metric, value, subScore, baseWeight, appliedWeight));
		}
		return new Score(style, clamp(composite), components);
	}

	public double subScore(Metric metric, double value) {
		if (!metric.inScoringDomain(value)) {
			return 0.0d;
		}
		return curves.get(metric).evaluate(value);
	}

	public Map<Metric, ScoringCurve> curves() {
		return curves;
	}

	private static double clamp(double value) {
		if (value < 0.0d) return 0.0d;
		if (value > 1.0d) return 1.0d;
		return value;
	}
}
