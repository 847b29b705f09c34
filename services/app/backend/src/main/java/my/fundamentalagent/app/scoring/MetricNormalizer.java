package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.AnnualFigure;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.model.TickerSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the indicator set used for scoring from a snapshot. Provider values always win; a derived
 * value only fills a gap the provider left.
 */
public final class MetricNormalizer {
	static final int CAGR_YEARS = 3;

	private MetricNormalizer() {
	}

	public static Map<Metric, Double> normalize(TickerSnapshot snapshot) {
		EnumMap<Metric, Double> metrics = new EnumMap<>(Metric.class);
		if (snapshot == null) {
			return metrics;
		}
		metrics.putAll(snapshot.metrics());
		if (!metrics.containsKey(Metric.PEG_RATIO)) {
			Double peg = derivePeg(metrics.get(Metric.PE_RATIO), metrics.get(Metric.EARNINGS_GROWTH));
			putIfFinite(metrics, Metric.PEG_RATIO, peg);
		}
		if (!metrics.containsKey(Metric.REVENUE_GROWTH)) {
			putIfFinite(metrics, Metric.REVENUE_GROWTH, revenueCagr(snapshot.revenueHistory()));
		}
		if (!metrics.containsKey(Metric.DIVIDEND_GROWTH_STREAK)) {
			Integer streak = dividendGrowthStreak(snapshot.dividendHistory());
			putIfFinite(metrics, Metric.DIVIDEND_GROWTH_STREAK, streak == null ? null : streak.doubleValue());
		}
		return Collections.unmodifiableMap(metrics);
	}

	/** PEG as P/E divided by earnings growth in percent; only defined for positive inputs. */
	static Double derivePeg(Double peRatio, Double earningsGrowth) {
		if (peRatio == null || earningsGrowth == null || peRatio <= 0.0d || earningsGrowth <= 0.0d) {
			return null;
		}
		return peRatio / (earningsGrowth * 100.0d);
	}

	/** Compound annual growth over the last {@value #CAGR_YEARS} years of a most-recent-first history. */
	static Double revenueCagr(List<AnnualFigure> history) {
		if (history == null || history.size() < CAGR_YEARS + 1) {
			return null;
		}
		double latest = history.get(0).value();
		double earliest = history.get(CAGR_YEARS).value();
		if (earliest <= 0.0d || latest < 0.0d) {
			return null;
		}
		return Math.pow(latest / earliest, 1.0d / CAGR_YEARS) - 1.0d;
	}

	/** Consecutive year-over-year dividend increases counted back from the most recent year. */
	static Integer dividendGrowthStreak(List<AnnualFigure> history) {
		if (history == null || history.size() < 2) {
			return null;
		}
		int streak = 0;
		for (int i = 0; i < history.size() - 1; i++) {
			if (history.get(i).value() > history.get(i + 1).value()) {
				streak++;
			} else {
				break;
			}
		}
		return streak;
	}

	private static void putIfFinite(Map<Metric, Double> metrics, Metric metric, Double value) {
		if (value != null && Double.isFinite(value)) {
			metrics.put(metric, value);
		}
	}
}
