package my.fundamentalagent.app.service;

import my.fundamentalagent.app.llm.LlmClient;
import my.fundamentalagent.app.llm.LlmCompletion;
import my.fundamentalagent.app.llm.LlmRequestException;
import my.fundamentalagent.app.llm.NoopLlmClient;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

@Service
public class DefaultNarrativeService implements NarrativeService {
	private static final Logger logger = LoggerFactory.getLogger(DefaultNarrativeService.class);
	private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

	private final LlmClient llmClient;
	private final NarrativePromptBuilder promptBuilder;
	private final boolean enabled;

	public DefaultNarrativeService(LlmClient llmClient, NarrativePromptBuilder promptBuilder) {
		this.llmClient = llmClient;
		this.promptBuilder = promptBuilder;
		this.enabled = !(llmClient instanceof NoopLlmClient);
	}

	@Override
	public boolean isEnabled() {
		return enabled;
	}

	@Override
	public String requestNarrative(TickerSnapshot snapshot, Score score) {
		if (!enabled) {
			throw new NarrativeServiceException("LLM disabled", null, null);
		}
		String prompt = promptBuilder.build(snapshot, score);
		LlmCompletion completion;
		try {
			logger.info("Sending narrative request to LLM (ticker={}, style={}, promptChars={}).",
					snapshot.ticker(), score.style().value(), prompt.length());
			completion = llmClient.complete(prompt);
		} catch (LlmRequestException ex) {
			throw new NarrativeServiceException("Narrative request failed: " + ex.getMessage(), ex.getStatusCode(), ex);
		} catch (RuntimeException ex) {
			throw new NarrativeServiceException("Narrative request failed: " + ex.getMessage(), null, ex);
		}
		String narrative = completion == null ? null : stripCodeFences(completion.text());
		if (narrative == null || narrative.isBlank()) {
			throw new NarrativeServiceException("LLM returned an empty narrative", null, null);
		}
		logger.info("LLM returned narrative for {} (model={}).", snapshot.ticker(), completion.model());
		logger.debug("LLM narrative for {}: {}", snapshot.ticker(), narrative);
		return narrative;
	}

	static String stripCodeFences(String text) {
		if (text == null) {
			return null;
		}
		return CODE_FENCE.matcher(text.trim()).replaceAll("").trim();
	}
}
