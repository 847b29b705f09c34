package my.fundamentalagent.app.model;

public record AnalysisError(AnalysisErrorCode code, String message, boolean retryable) {
	public static AnalysisError from(AnalysisException ex) {
		return new AnalysisError(ex.getCode(), ex.getMessage(), ex.isRetryable());
	}
}
