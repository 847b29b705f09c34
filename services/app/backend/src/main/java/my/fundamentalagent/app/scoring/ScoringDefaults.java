package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.Metric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Benchmarks used when {@code app.scoring.curves} does not override a metric.
 */
public final class ScoringDefaults {
	private static final Map<Metric, ScoringCurve> CURVES;

	static {
		EnumMap<Metric, ScoringCurve> curves = new EnumMap<>(Metric.class);
		curves.put(Metric.REVENUE_GROWTH, ScoringCurve.linear(0.0d, 0.20d));
		curves.put(Metric.EARNINGS_GROWTH, ScoringCurve.linear(0.0d, 0.25d));
		curves.put(Metric.PEG_RATIO, ScoringCurve.linear(2.5d, 1.0d));
		curves.put(Metric.ROE, ScoringCurve.linear(0.05d, 0.20d));
		curves.put(Metric.PE_RATIO, ScoringCurve.linear(30.0d, 10.0d));
		curves.put(Metric.PB_RATIO, ScoringCurve.linear(4.0d, 1.0d));
		curves.put(Metric.DEBT_TO_EQUITY, ScoringCurve.linear(2.0d, 0.3d));
		// yields past the 8% sustainability ceiling score progressively lower
		curves.put(Metric.DIVIDEND_YIELD, ScoringCurve.peaked(0.01d, 0.04d, 0.08d, 0.20d));
		curves.put(Metric.PAYOUT_RATIO, ScoringCurve.peaked(0.0d, 0.30d, 0.60d, 1.0d));
		curves.put(Metric.DIVIDEND_GROWTH_STREAK, ScoringCurve.linear(0.0d, 5.0d));
		curves.put(Metric.PROFIT_MARGIN, ScoringCurve.linear(0.0d, 0.20d));
		curves.put(Metric.OPERATING_CASH_FLOW, ScoringCurve.of(List.of(new ScoringCurve.Point(0.0d, 1.0d))));
		CURVES = Collections.unmodifiableMap(curves);
	}

	private ScoringDefaults() {
	}

	public static Map<Metric, ScoringCurve> curves() {
		return CURVES;
	}
}
