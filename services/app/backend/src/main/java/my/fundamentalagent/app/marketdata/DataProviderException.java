package my.fundamentalagent.app.marketdata;

import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.AnalysisException;

public class DataProviderException extends AnalysisException {
	private final Integer statusCode;

	public DataProviderException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(AnalysisErrorCode.INTERNAL_ERROR, message, retryable, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
