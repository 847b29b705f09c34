package my.fundamentalagent.app.model;

/**
 * Maps a composite score to an action: {@code composite >= buy} is a buy, {@code composite < sell}
 * is a sell, everything in between is a hold.
 */
public record ActionThresholds(double buy, double sell) {
	public static final double DEFAULT_BUY = 0.70d;
	public static final double DEFAULT_SELL = 0.40d;

	public ActionThresholds {
		if (!(sell >= 0.0d && sell <= buy && buy <= 1.0d)) {
			throw new IllegalArgumentException("Invalid action thresholds (buy=" + buy + ", sell=" + sell + ")");
		}
	}

	public static ActionThresholds defaults() {
		return new ActionThresholds(DEFAULT_BUY, DEFAULT_SELL);
	}

	public Action actionFor(double composite) {
		if (composite >= buy) {
			return Action.BUY;
		}
		if (composite >= sell) {
			return Action.HOLD;
		}
		return Action.SELL;
	}
}
