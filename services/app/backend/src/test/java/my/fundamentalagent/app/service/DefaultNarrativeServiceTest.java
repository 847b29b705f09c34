package my.fundamentalagent.app.service;

import my.fundamentalagent.app.llm.LlmClient;
import my.fundamentalagent.app.llm.LlmCompletion;
import my.fundamentalagent.app.llm.LlmRequestException;
import my.fundamentalagent.app.llm.NoopLlmClient;
import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import my.fundamentalagent.app.scoring.ScoringEngine;
import my.fundamentalagent.app.support.TestSnapshots;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultNarrativeServiceTest {
	private final NarrativePromptBuilder promptBuilder = new NarrativePromptBuilder();
	private final TickerSnapshot snapshot = TestSnapshots.growth("AAPL");
	private final Score score = new ScoringEngine().score(snapshot, InvestorStyle.GROWTH);

	@Test
	void returnsNarrativeWithoutCodeFences() {
		AtomicReference<String> prompt = new AtomicReference<>();
		LlmClient client = text -> {
			prompt.set(text);
			return new LlmCompletion("```text\nRevenue is compounding quickly.\n```", "test-model");
		};
		DefaultNarrativeService service = new DefaultNarrativeService(client, promptBuilder);

		String narrative = service.requestNarrative(snapshot, score);

		assertThat(service.isEnabled()).isTrue();
		assertThat(narrative).isEqualTo("Revenue is compounding quickly.");
		assertThat(prompt.get()).isEqualTo(promptBuilder.build(snapshot, score));
	}

	@Test
	void llmFailureBecomesModelError() {
		LlmClient client = text -> {
			throw new LlmRequestException("HTTP 429", 429, true, null);
		};
		DefaultNarrativeService service = new DefaultNarrativeService(client, promptBuilder);

		assertThatThrownBy(() -> service.requestNarrative(snapshot, score))
				.isInstanceOfSatisfying(NarrativeServiceException.class, ex -> {
					assertThat(ex.getStatusCode()).isEqualTo(429);
					assertThat(ex.getCode()).isEqualTo(AnalysisErrorCode.MODEL_ERROR);
					assertThat(ex.isRetryable()).isTrue();
					assertThat(ex.getCause()).isInstanceOf(LlmRequestException.class);
				});
	}

	@Test
	void blankReplyIsRejected() {
		DefaultNarrativeService service = new DefaultNarrativeService(text -> new LlmCompletion("```\n```", "m"),
				promptBuilder);

		assertThatThrownBy(() -> service.requestNarrative(snapshot, score))
				.isInstanceOf(NarrativeServiceException.class)
				.hasMessageContaining("empty");
	}

	@Test
	void noopClientDisablesNarratives() {
		DefaultNarrativeService service = new DefaultNarrativeService(new NoopLlmClient(), promptBuilder);

		assertThat(service.isEnabled()).isFalse();
		assertThatThrownBy(() -> service.requestNarrative(snapshot, score))
				.isInstanceOf(NarrativeServiceException.class);
	}

	@Test
	void stripsOnlySurroundingFences() {
		assertThat(DefaultNarrativeService.stripCodeFences("```markdown\nA `b` c\n```")).isEqualTo("A `b` c");
		assertThat(DefaultNarrativeService.stripCodeFences("  plain text ")).isEqualTo("plain text");
		assertThat(DefaultNarrativeService.stripCodeFences(null)).isNull();
	}
}
