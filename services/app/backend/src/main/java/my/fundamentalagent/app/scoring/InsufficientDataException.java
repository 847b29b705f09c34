package my.fundamentalagent.app.scoring;

import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.AnalysisException;

public class InsufficientDataException extends AnalysisException {
	public InsufficientDataException(String message) {
		super(AnalysisErrorCode.INSUFFICIENT_DATA, message, false, null);
	}
}
