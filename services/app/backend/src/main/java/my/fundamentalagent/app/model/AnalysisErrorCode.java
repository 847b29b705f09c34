package my.fundamentalagent.app.model;

public enum AnalysisErrorCode {
	TICKER_NOT_FOUND,
	INSUFFICIENT_DATA,
	MODEL_ERROR,
	INTERNAL_ERROR
}
