package my.fundamentalagent.app.model;

/**
 * Fixed vocabulary of financial indicators exchanged between data providers and the scoring engine.
 * Growth rates, margins, yields and ratios of earnings are decimal fractions (18% is {@code 0.18});
 * debt to equity is a plain ratio, not a percentage.
 */
public enum Metric {
	ROE("Return on Equity (ROE)", MetricFormat.PERCENT, "roe", Domain.ANY),
	DEBT_TO_EQUITY("Debt to Equity Ratio", MetricFormat.RATIO, "debt-to-equity", Domain.NON_NEGATIVE),
	PROFIT_MARGIN("Profit Margins", MetricFormat.PERCENT, "profit-margin", Domain.ANY),
	PE_RATIO("P/E Ratio", MetricFormat.RATIO, "pe-ratio", Domain.POSITIVE),
	FORWARD_PE("Forward P/E Ratio", MetricFormat.RATIO, "forward-pe", Domain.POSITIVE),
	PB_RATIO("P/B Ratio", MetricFormat.RATIO, "pb-ratio", Domain.POSITIVE),
	EPS("Earnings Per Share (EPS)", MetricFormat.RATIO, "eps", Domain.ANY),
	REVENUE_GROWTH("Revenue Growth (YoY)", MetricFormat.PERCENT, "revenue-growth", Domain.ANY),
	EARNINGS_GROWTH("EPS Growth (YoY)", MetricFormat.PERCENT, "earnings-growth", Domain.ANY),
	PEG_RATIO("PEG Ratio", MetricFormat.RATIO, "peg-ratio", Domain.POSITIVE),
	OPERATING_CASH_FLOW("Operating Cash Flow", MetricFormat.CURRENCY, "operating-cash-flow", Domain.POSITIVE),
	DIVIDEND_YIELD("Dividend Yield", MetricFormat.PERCENT, "dividend-yield", Domain.ANY),
	PAYOUT_RATIO("Payout Ratio", MetricFormat.PERCENT, "payout-ratio", Domain.ANY),
	DIVIDEND_GROWTH_STREAK("Dividend Growth Streak (years)", MetricFormat.COUNT, "dividend-growth-streak", Domain.ANY);

	private final String label;
	private final MetricFormat format;
	private final String configKey;
	private final Domain domain;

	Metric(String label, MetricFormat format, String configKey, Domain domain) {
		this.label = label;
		this.format = format;
		this.configKey = configKey;
		this.domain = domain;
	}

	public String label() {
		return label;
	}

	public MetricFormat format() {
		return format;
	}

	public String configKey() {
		return configKey;
	}

	/**
	 * Whether a reading is meaningful for scoring. Readings outside the domain (losses, negative
	 * book value, negative shareholder equity) always score zero.
	 */
	public boolean inScoringDomain(double value) {
		return switch (domain) {
			case ANY -> true;
			case NON_NEGATIVE -> value >= 0.0d;
			case POSITIVE -> value > 0.0d;
		};
	}

	public String formatValue(Double value) {
		return format.format(value);
	}

	enum Domain {
		ANY,
		NON_NEGATIVE,
		POSITIVE
	}
}
