package my.fundamentalagent.app.model;

/**
 * Base for failures that can end an analysis request. Each carries the error code reported to
 * callers and whether repeating the request later may succeed.
 */
public class AnalysisException extends RuntimeException {
	private final AnalysisErrorCode code;
	private final boolean retryable;

	public AnalysisException(AnalysisErrorCode code, String message, boolean retryable, Throwable cause) {
		super(message, cause);
		this.code = code;
		this.retryable = retryable;
	}

	public AnalysisErrorCode getCode() {
		return code;
	}

	public boolean isRetryable() {
		return retryable;
	}
}
