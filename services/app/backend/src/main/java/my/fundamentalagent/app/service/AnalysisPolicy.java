package my.fundamentalagent.app.service;

import my.fundamentalagent.app.model.ActionThresholds;

/**
 * Request-level knobs of the orchestrator. Backoff for attempt {@code n} is
 * {@code min(maxBackoff, baseBackoff * 2^(n-1))} scaled by a jitter factor in [0.5, 1.5).
 */
public record AnalysisPolicy(
		int maxAttempts,
		long baseBackoffMillis,
		long maxBackoffMillis,
		boolean fallbackEnabled,
		ActionThresholds thresholds
) {
	public static final int DEFAULT_MAX_ATTEMPTS = 3;
	public static final long DEFAULT_BASE_BACKOFF_MILLIS = 500L;
	public static final long DEFAULT_MAX_BACKOFF_MILLIS = 4000L;

	public AnalysisPolicy {
		maxAttempts = Math.max(1, maxAttempts);
		baseBackoffMillis = Math.max(0L, baseBackoffMillis);
		maxBackoffMillis = Math.max(baseBackoffMillis, maxBackoffMillis);
		thresholds = thresholds == null ? ActionThresholds.defaults() : thresholds;
	}

	public static AnalysisPolicy defaults() {
		return new AnalysisPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF_MILLIS, DEFAULT_MAX_BACKOFF_MILLIS, true,
				ActionThresholds.defaults());
	}
}
