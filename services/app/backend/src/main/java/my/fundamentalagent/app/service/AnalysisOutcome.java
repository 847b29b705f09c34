package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.AnalysisError;
import my.fundamentalagent.app.model.AnalysisResult;
import my.fundamentalagent.app.model.InvestorStyle;

import java.util.List;

/**
 * Terminal outcome of one analysis request. Exactly one of {@code result} and {@code error} is set;
 * {@code states} lists every state the request passed through, ending with the terminal one.
 */
public record AnalysisOutcome(
		String ticker,
		InvestorStyle style,
		AnalysisState state,
		AnalysisResult result,
		AnalysisError error,
		boolean cacheHit,
		List<AnalysisState> states
) {
	public AnalysisOutcome {
		states = states == null ? List.of() : List.copyOf(states);
	}

	public static AnalysisOutcome success(String ticker, InvestorStyle style, AnalysisResult result, boolean cacheHit,
										  List<AnalysisState> states) {
		return new AnalysisOutcome(ticker, style, AnalysisState.SUCCESS, result, null, cacheHit, states);
	}

	public static AnalysisOutcome failure(String ticker, InvestorStyle style, AnalysisError error,
										  List<AnalysisState> states) {
		return new AnalysisOutcome(ticker, style, AnalysisState.FAILURE, null, error, false, states);
	}

	public boolean isSuccess() {
		return state == AnalysisState.SUCCESS;
	}
}
