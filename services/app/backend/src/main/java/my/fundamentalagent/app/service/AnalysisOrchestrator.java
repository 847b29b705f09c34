package my.fundamentalagent.app.service;

import my.fundamentalagent.app.cache.AnalysisCache;
import my.fundamentalagent.app.cache.CacheKey;
import my.fundamentalagent.app.marketdata.DataProviderException;
import my.fundamentalagent.app.marketdata.FinancialDataProvider;
import my.fundamentalagent.app.model.AnalysisError;
import my.fundamentalagent.app.model.AnalysisErrorCode;
import my.fundamentalagent.app.model.AnalysisException;
import my.fundamentalagent.app.model.AnalysisResult;
import my.fundamentalagent.app.model.AnalysisSource;
import my.fundamentalagent.app.model.InvestorStyle;
import my.fundamentalagent.app.model.Score;
import my.fundamentalagent.app.model.TickerSnapshot;
import my.fundamentalagent.app.scoring.InsufficientDataException;
import my.fundamentalagent.app.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Runs one analysis request through
 * {@code CHECK_CACHE -> FETCH_DATA -> SCORE -> NARRATE -> [FALLBACK] -> FINALIZE}. Each request is
 * sequential and holds no state beyond its own call; the cache is the only shared resource.
 */
@Service
public class AnalysisOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisOrchestrator.class);

	private final AnalysisCache cache;
	private final FinancialDataProvider dataProvider;
	private final ScoringEngine scoringEngine;
	private final NarrativeService narrativeService;
	private final RuleBasedFallbackAnalyzer fallbackAnalyzer;
	private final AnalysisPolicy policy;
	private final Clock clock;
	private final Random jitter = new Random();

	public AnalysisOrchestrator(AnalysisCache cache,
								FinancialDataProvider dataProvider,
								ScoringEngine scoringEngine,
								NarrativeService narrativeService,
								RuleBasedFallbackAnalyzer fallbackAnalyzer,
								AnalysisPolicy policy,
								Clock clock) {
		this.cache = cache;
		this.dataProvider = dataProvider;
		this.scoringEngine = scoringEngine;
		this.narrativeService = narrativeService;
		this.fallbackAnalyzer = fallbackAnalyzer;
		this.policy = policy == null ? AnalysisPolicy.defaults() : policy;
		this.clock = clock;
	}

	public AnalysisOutcome analyze(String ticker, InvestorStyle style) {
		String symbol = TickerSnapshot.normalizeTicker(ticker);
		if (symbol.isEmpty()) {
			throw new IllegalArgumentException("Ticker is required");
		}
		if (style == null) {
			throw new IllegalArgumentException("Investor style is required");
		}
		List<AnalysisState> states = new ArrayList<>();
		LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
		try {
			states.add(AnalysisState.CHECK_CACHE);
			CacheKey resultKey = CacheKey.result(symbol, style, today);
			Optional<AnalysisResult> cached = cache.get(resultKey, AnalysisResult.class);
			if (cached.isPresent()) {
				logger.info("Result cache hit for {} ({}).", symbol, style.value());
				states.add(AnalysisState.SUCCESS);
				return AnalysisOutcome.success(symbol, style, cached.get(), true, states);
			}

			states.add(AnalysisState.FETCH_DATA);
			TickerSnapshot snapshot = loadSnapshot(symbol, today);

			states.add(AnalysisState.SCORE);
			Score score = scoringEngine.score(snapshot, style);
			logger.info("Scored {} as {}: composite={}.", symbol, style.value(), score.composite());

			states.add(AnalysisState.NARRATE);
			NarrationOutcome narration = narrate(snapshot, score);
			AnalysisResult result;
			if (narration.isAvailable()) {
				result = new AnalysisResult(policy.thresholds().actionFor(score.composite()), score.composite(),
						narration.text(), AnalysisSource.LLM, clock.instant(), score);
			} else if (policy.fallbackEnabled()) {
				states.add(AnalysisState.FALLBACK);
				logger.warn("Narrative unavailable for {} ({}); using rule-based fallback.", symbol, narration.unavailableReason());
				result = fallbackAnalyzer.fallback(score);
			} else {
				throw new NarrativeServiceException("Narrative unavailable: " + narration.unavailableReason(), null, null);
			}

			states.add(AnalysisState.FINALIZE);
			cache.put(resultKey, result);
			states.add(AnalysisState.SUCCESS);
			return AnalysisOutcome.success(symbol, style, result, false, states);
		} catch (AnalysisException ex) {
			if (ex.getCode() == AnalysisErrorCode.INTERNAL_ERROR || ex.getCode() == AnalysisErrorCode.MODEL_ERROR) {
				logger.error("Analysis of {} ({}) failed: {}", symbol, style.value(), ex.getMessage(), ex);
			} else {
				logger.info("Analysis of {} ({}) ended with {}: {}", symbol, style.value(), ex.getCode(), ex.getMessage());
			}
			states.add(AnalysisState.FAILURE);
			return AnalysisOutcome.failure(symbol, style, AnalysisError.from(ex), states);
		}
	}

	private TickerSnapshot loadSnapshot(String symbol, LocalDate today) {
		CacheKey rawKey = CacheKey.raw(symbol, today);
		Optional<TickerSnapshot> cached = cache.get(rawKey, TickerSnapshot.class);
		if (cached.isPresent()) {
			logger.info("Raw cache hit for {}.", symbol);
			return cached.get();
		}
		logger.info("Raw cache miss for {}; fetching from data provider.", symbol);
		TickerSnapshot snapshot = fetchWithRetry(symbol);
		if (snapshot == null || !snapshot.hasAnyMetric()) {
			throw new InsufficientDataException("Could not retrieve any key financial metrics for " + symbol);
		}
		cache.put(rawKey, snapshot);
		return snapshot;
	}

	private NarrationOutcome narrate(TickerSnapshot snapshot, Score score) {
		if (!narrativeService.isEnabled()) {
			return NarrationOutcome.unavailable("LLM disabled");
		}
		try {
			return NarrationOutcome.llm(narrativeService.requestNarrative(snapshot, score));
		} catch (NarrativeServiceException ex) {
			return NarrationOutcome.unavailable(ex.getMessage());
		} catch (RuntimeException ex) {
			logger.warn("Unexpected narrative failure for {}: {}", snapshot.ticker(), ex.getMessage(), ex);
			return NarrationOutcome.unavailable(ex.getMessage());
		}
	}

	private TickerSnapshot fetchWithRetry(String symbol) {
		int maxAttempts = policy.maxAttempts();
		DataProviderException lastRetryable = null;
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			try {
				return dataProvider.fetchSnapshot(symbol);
			} catch (DataProviderException ex) {
				if (!ex.isRetryable()) {
					throw ex;
				}
				lastRetryable = ex;
				if (attempt == maxAttempts) {
					logger.error("Data provider retries exhausted for {} after {} attempts.", symbol, maxAttempts);
					break;
				}
				long sleepMillis = backoffMillis(attempt);
				logger.warn("Data provider attempt {}/{} for {} failed ({}); retrying in {} ms.",
						attempt, maxAttempts, symbol, ex.getMessage(), sleepMillis);
				if (sleepMillis > 0) {
					try {
						Thread.sleep(sleepMillis);
					} catch (InterruptedException iex) {
						Thread.currentThread().interrupt();
						throw ex;
					}
				}
			}
		}
		throw lastRetryable;
	}

	long backoffMillis(int attempt) {
		long base = policy.baseBackoffMillis();
		if (base <= 0) {
			return 0L;
		}
		long exponential = Math.min(policy.maxBackoffMillis(), base * (1L << Math.min(20, attempt - 1)));
		double jitterFactor = 0.5 + jitter.nextDouble();
		return Math.round(exponential * jitterFactor);
	}
}
