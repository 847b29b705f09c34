package my.fundamentalagent.app.marketdata;

import my.fundamentalagent.app.model.TickerSnapshot;

public interface FinancialDataProvider {
	/**
	 * Fetches the current figures for one ticker.
	 *
	 * @throws TickerNotFoundException when the provider does not know the ticker
	 * @throws DataProviderException when the provider could not be queried or answered garbage
	 */
	TickerSnapshot fetchSnapshot(String ticker);
}
