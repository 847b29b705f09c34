package my.fundamentalagent.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmCompletion complete(String prompt) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}
}
