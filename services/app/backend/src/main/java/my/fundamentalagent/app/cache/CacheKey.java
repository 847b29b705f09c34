package my.fundamentalagent.app.cache;

import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.TickerSnapshot;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * Identifies one cache entry. Raw entries are keyed by ticker and UTC day; result entries also carry
 * the investor style. Tickers are case-normalized so {@code aapl} and {@code AAPL} share an entry.
 */
public record CacheKey(CacheTier tier, String ticker, InvestorStyle style, LocalDate day) {
	public CacheKey {
		if (tier == null) {
			throw new IllegalArgumentException("Cache tier is required");
		}
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("Cache key requires a ticker");
		}
		if (day == null) {
			throw new IllegalArgumentException("Cache key requires a day");
		}
		ticker = TickerSnapshot.normalizeTicker(ticker);
		if (tier == CacheTier.RAW) {
			style = null;
		} else if (style == null) {
			throw new IllegalArgumentException("Result cache key requires an investor style");
		}
	}

	public static CacheKey raw(String ticker, LocalDate day) {
		return new CacheKey(CacheTier.RAW, ticker, null, day);
	}

	public static CacheKey result(String ticker, InvestorStyle style, LocalDate day) {
		return new CacheKey(CacheTier.RESULT, ticker, style, day);
	}

	/**
	 * File-system safe name for this key within its tier. Characters outside {@code [A-Z0-9-]} are
	 * written as {@code _XX} hex escapes, so distinct keys never share a name.
	 */
	public String fileName() {
		StringBuilder name = new StringBuilder(escape(ticker));
		if (style != null) {
			name.append('.').append(style.value());
		}
		name.append('.').append(day).append(".json");
		return name.toString();
	}

	@Override
	public String toString() {
		return tier.value() + ":" + ticker + (style == null ? "" : ":" + style.value()) + ":" + day;
	}

	static String escape(String value) {
		StringBuilder escaped = new StringBuilder();
		for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
			char c = (char) (b & 0xff);
			if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-') {
				escaped.append(c);
			} else {
				escaped.append('_').append(String.format("%02X", b & 0xff));
			}
		}
		return escaped.toString();
	}
}
