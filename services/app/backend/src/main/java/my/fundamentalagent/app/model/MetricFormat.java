package my.fundamentalagent.app.model;

import java.util.Locale;

public enum MetricFormat {
	PERCENT,
	RATIO,
	CURRENCY,
	COUNT;

	public String format(Double value) {
		if (value == null) {
			return "N/A";
		}
		return switch (this) {
			case PERCENT -> String.format(Locale.ROOT, "%.2f%%", value * 100.0);
			case RATIO -> String.format(Locale.ROOT, "%.2f", value);
			case CURRENCY -> String.format(Locale.ROOT, "$%,.0f", value);
			case COUNT -> String.format(Locale.ROOT, "%.0f", value);
		};
	}
}
