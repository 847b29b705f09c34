package my.fundamentalagent.app.config;

import my.fundamentalagent.app.llm.LlmClient;
import my.fundamentalagent.app.llm.NoopLlmClient;
import my.fundamentalagent.app.llm.OpenAiLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;

@Configuration
public class LlmConfig {
	private static final Logger logger = LoggerFactory.getLogger(LlmConfig.class);
	static final String OPENAI_BASE_URL = "https://api.openai.com/v1";
	static final String OLLAMA_BASE_URL = "http://ollama:11434/v1";

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openai")
	public OpenAiLlmClient openAiLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = openAi(properties);
		String model = openai == null ? null : openai.model();
		if (model == null || model.isBlank()) {
			model = "gpt-4o-mini";
		}
		logger.info("LLM client enabled (provider=openai, model={}).", model);
		return build(openai, OPENAI_BASE_URL, model);
	}

	@Bean
	@ConditionalOnProperty(name = "app.llm.provider", havingValue = "ollama")
	public OpenAiLlmClient ollamaLlmClient(AppProperties properties) {
		AppProperties.Llm.OpenAi openai = openAi(properties);
		String resolved = resolveOllamaModel(openai == null ? null : openai.model());
		logger.info("LLM client enabled (provider=ollama, model={}).", resolved);
		return build(openai, OLLAMA_BASE_URL, resolved);
	}

	@Bean
	@ConditionalOnMissingBean(LlmClient.class)
	public NoopLlmClient noopLlmClient() {
		logger.info("LLM client disabled (provider=noop).");
		return new NoopLlmClient();
	}

	private OpenAiLlmClient build(AppProperties.Llm.OpenAi openai, String defaultBaseUrl, String model) {
		String baseUrl = openai == null || openai.baseUrl() == null || openai.baseUrl().isBlank()
				? defaultBaseUrl
				: openai.baseUrl();
		String apiKey = openai == null ? null : openai.apiKey();
		Double temperature = openai == null ? null : openai.temperature();
		Integer connectTimeoutSeconds = openai == null ? null : openai.connectTimeoutSeconds();
		Integer readTimeoutSeconds = openai == null ? null : openai.readTimeoutSeconds();
		int connectTimeout = connectTimeoutSeconds == null ? 10 : Math.max(1, connectTimeoutSeconds);
		int readTimeout = readTimeoutSeconds == null ? 60 : Math.max(1, readTimeoutSeconds);
		return new OpenAiLlmClient(baseUrl, apiKey, model, temperature,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}

	private AppProperties.Llm.OpenAi openAi(AppProperties properties) {
		return properties == null || properties.llm() == null ? null : properties.llm().openai();
	}

	private String resolveOllamaModel(String model) {
		if (model == null || model.isBlank()) {
			return "llama3.1:8b";
		}
		String lower = model.toLowerCase(Locale.ROOT);
		if (lower.startsWith("gpt-") || lower.startsWith("o1") || lower.startsWith("o3")
				|| lower.startsWith("o4")) {
			return "llama3.1:8b";
		}
		return model;
	}
}
