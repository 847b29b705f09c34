package my.fundamentalagent.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints (OpenAI itself, or Ollama's
 * {@code /v1} API).
 */
public class OpenAiLlmClient implements LlmClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
	static final String SYSTEM_PROMPT = "You are a financial analyst. Answer in plain text only. "
			+ "Do not wrap the answer in Markdown code fences.";

	private final RestClient restClient;
	private final String model;
	private final Double temperature;

	public OpenAiLlmClient(String baseUrl, String apiKey, String model) {
		this(baseUrl, apiKey, model, null, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public OpenAiLlmClient(String baseUrl, String apiKey, String model, Double temperature,
						   Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		RestClient.Builder builder = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
		if (apiKey != null && !apiKey.isBlank()) {
			builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
		}
		this.restClient = builder.build();
		this.model = model;
		this.temperature = temperature;
	}

	public String model() {
		return model;
	}

	@Override
	public LlmCompletion complete(String prompt) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("messages", List.of(
				Map.of("role", "system", "content", SYSTEM_PROMPT),
				Map.of("role", "user", "content", prompt == null ? "" : prompt)
		));
		if (temperature != null) {
			request.put("temperature", temperature);
		}
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new LlmRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new LlmRequestException(safeMessage(ex), null, true, ex);
		} catch (Exception ex) {
			throw new LlmRequestException(safeMessage(ex), null, false, ex);
		}
		String text = extractContent(response);
		if (text == null || text.isBlank()) {
			throw new LlmRequestException("No content in chat completion", null, false, null);
		}
		Object responseModel = response.get("model");
		return new LlmCompletion(text, responseModel == null ? model : responseModel.toString());
	}

	private String extractContent(Map<?, ?> response) {
		if (response == null) {
			return null;
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return null;
		}
		Object first = list.get(0);
		if (!(first instanceof Map<?, ?> map)) {
			return null;
		}
		Object message = map.get("message");
		if (!(message instanceof Map<?, ?> msgMap)) {
			return null;
		}
		Object content = msgMap.get("content");
		return content == null ? null : content.toString();
	}

	private boolean isRetryable(RestClientResponseException ex) {
		if (ex == null || ex.getStatusCode() == null) {
			return false;
		}
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		if (ex == null) {
			return "Unknown error";
		}
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
