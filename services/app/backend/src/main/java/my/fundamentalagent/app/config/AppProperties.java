package my.fundamentalagent.app.config;

import jakarta.validation.constraints.NotBlank;
import my.fundamentalagent.app.scoring.ScoringCurve;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Llm llm,
		Provider provider,
		Cache cache,
		Analysis analysis,
		Scoring scoring
) {
	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Double temperature,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Provider(
			Integer maxAttempts,
			Long baseBackoffMillis,
			Long maxBackoffMillis,
			Yahoo yahoo
	) {
		public record Yahoo(
				String baseUrl,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Cache(
			String store,
			String directory,
			Duration rawTtl,
			Duration resultTtl
	) {
	}

	public record Analysis(
			Boolean fallbackEnabled,
			Thresholds thresholds
	) {
		public record Thresholds(
				Double buy,
				Double sell
		) {
		}
	}

	/**
	 * Curve overrides keyed by {@code Metric#configKey()}, e.g.
	 * {@code app.scoring.curves.pe-ratio[0].x=10}.
	 */
	public record Scoring(
			Map<String, List<ScoringCurve.Point>> curves
	) {
	}
}
