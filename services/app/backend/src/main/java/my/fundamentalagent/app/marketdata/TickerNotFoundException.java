package my.fundamentalagent.app.marketdata;

import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.AnalysisException;

public class TickerNotFoundException extends AnalysisException {
	private final String ticker;

	public TickerNotFoundException(String ticker) {
		super(AnalysisErrorCode.TICKER_NOT_FOUND, "No data found for ticker '" + ticker + "'. It may be delisted or invalid.",
				false, null);
		this.ticker = ticker;
	}

	public String getTicker() {
		return ticker;
	}
}
