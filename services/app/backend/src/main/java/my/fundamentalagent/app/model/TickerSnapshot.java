package my.fundamentalagent.app.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Provider-agnostic financial figures for one ticker on one day. A metric missing from
 * {@link #metrics()} is unavailable; non-finite values are dropped on construction.
 * Histories are ordered most recent year first.
 */
public record TickerSnapshot(
		String ticker,
		LocalDate asOf,
		Map<Metric, Double> metrics,
		List<AnnualFigure> dividendHistory,
		List<AnnualFigure> revenueHistory
) {
	public TickerSnapshot {
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("Ticker is required");
		}
		ticker = normalizeTicker(ticker);
		EnumMap<Metric, Double> copy = new EnumMap<>(Metric.class);
		if (metrics != null) {
			metrics.forEach((metric, value) -> {
				if (metric != null && value != null && Double.isFinite(value)) {
					copy.put(metric, value);
				}
			});
		}
		metrics = Collections.unmodifiableMap(copy);
		dividendHistory = sortedHistory(dividendHistory);
		revenueHistory = sortedHistory(revenueHistory);
	}

	public OptionalDouble metric(Metric metric) {
		Double value = metrics.get(metric);
		return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
	}

	public boolean hasAnyMetric() {
		return !metrics.isEmpty();
	}

	public static String normalizeTicker(String ticker) {
		return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
	}

	private static List<AnnualFigure> sortedHistory(List<AnnualFigure> history) {
		if (history == null || history.isEmpty()) {
			return List.of();
		}
		List<AnnualFigure> sorted = new ArrayList<>();
		for (AnnualFigure figure : history) {
			if (figure != null && Double.isFinite(figure.value())) {
				sorted.add(figure);
			}
		}
		sorted.sort(Comparator.comparingInt(AnnualFigure::year).reversed());
		return List.copyOf(sorted);
	}
}
