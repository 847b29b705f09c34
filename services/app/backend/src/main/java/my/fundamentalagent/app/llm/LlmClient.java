package my.fundamentalagent.app.llm;

public interface LlmClient {
	/**
	 * Sends a single prompt and returns the model's reply.
	 *
	 * @throws LlmRequestException on transport failures, error statuses and empty replies
	 */
	LlmCompletion complete(String prompt);
}
