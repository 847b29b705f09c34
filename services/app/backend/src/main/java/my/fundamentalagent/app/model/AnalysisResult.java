package my.fundamentalagent.app.model;

import java.time.Instant;

public record AnalysisResult(
		Action action,
		double confidence,
		String reason,
		AnalysisSource source,
		Instant generatedAt,
		Score score
) {
}
