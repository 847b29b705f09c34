package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;

public interface NarrativeService {
	boolean isEnabled();

	/**
	 * Requests a natural-language explanation for a computed score.
	 *
	 * @throws NarrativeServiceException when no usable narrative could be obtained
	 */
	String requestNarrative(TickerSnapshot snapshot, Score score);
}
