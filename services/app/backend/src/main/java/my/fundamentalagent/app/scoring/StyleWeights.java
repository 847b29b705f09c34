package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Metric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static metric weights per investor style. Each table sums to 1.0 and its iteration order is the
 * order in which breakdowns and prompts list the metrics.
 */
public final class StyleWeights {
	private StyleWeights() {
	}

	public static Map<Metric, Double> forStyle(InvestorStyle style) {
		return switch (style) {
			case GROWTH -> table(
					Metric.REVENUE_GROWTH, 0.30d,
					Metric.EARNINGS_GROWTH, 0.25d,
					Metric.PEG_RATIO, 0.25d,
					Metric.ROE, 0.20d);
			case VALUE -> table(
					Metric.PE_RATIO, 0.35d,
					Metric.PB_RATIO, 0.25d,
					Metric.DEBT_TO_EQUITY, 0.25d,
					Metric.ROE, 0.15d);
			case DIVIDEND -> table(
					Metric.DIVIDEND_YIELD, 0.35d,
					Metric.PAYOUT_RATIO, 0.30d,
					Metric.DIVIDEND_GROWTH_STREAK, 0.20d,
					Metric.DEBT_TO_EQUITY, 0.15d);
			case QUALITY -> table(
					Metric.ROE, 0.35d,
					Metric.PROFIT_MARGIN, 0.25d,
					Metric.DEBT_TO_EQUITY, 0.25d,
					Metric.OPERATING_CASH_FLOW, 0.15d);
		};
	}

	private static Map<Metric, Double> table(Metric m1, double w1, Metric m2, double w2,
											 Metric m3, double w3, Metric m4, double w4) {
		Map<Metric, Double> weights = new LinkedHashMap<>();
		weights.put(m1, w1);
		weights.put(m2, w2);
		weights.put(m3, w3);
		weights.put(m4, w4);
		return Collections.unmodifiableMap(weights);
	}
}
