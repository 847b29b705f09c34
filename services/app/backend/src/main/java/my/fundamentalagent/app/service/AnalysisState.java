package my.fundamentalagent.app.service;

public enum AnalysisState {
	CHECK_CACHE,
	FETCH_DATA,
	SCORE,
	NARRATE,
	FALLBACK,
	FINALIZE,
	SUCCESS,
	FAILURE;

	public boolean isTerminal() {
		return this == SUCCESS || this == FAILURE;
	}
}
