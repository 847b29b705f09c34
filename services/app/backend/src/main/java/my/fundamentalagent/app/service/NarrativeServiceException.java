package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.AnalysisException;

public class NarrativeServiceException extends AnalysisException {
	private final Integer statusCode;

	public NarrativeServiceException(String message, Integer statusCode, Throwable cause) {
		super(AnalysisErrorCode.MODEL_ERROR, message, true, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
