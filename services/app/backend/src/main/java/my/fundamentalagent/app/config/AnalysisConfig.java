package my.fundamentalagent.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.fundamentalagent.app.cache.AnalysisCache;
import my.fundamentalagent.app.cache.CacheStore;
import my.fundamentalagent.app.cache.FileCacheStore;
import my.fundamentalagent.app.cache.InMemoryCacheStore;
import my.fundamentalagent.app.marketdata.FinancialDataProvider;
import my.fundamentalagent.app.marketdata.YahooFinanceDataProvider;
import my.fundamentalagent.app.model.ActionThresholds;
import my.fundamentalagent.app.model.Metric;
import my.fundamentalagent.app.scoring.ScoringCurve;
import my.fundamentalagent.app.scoring.ScoringEngine;
import my.fundamentalagent.app.service.AnalysisPolicy;
import my.fundamentalagent.app.service.RuleBasedFallbackAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Configuration
public class AnalysisConfig {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);
	static final Duration DEFAULT_RAW_TTL = Duration.ofHours(24);
	static final Duration DEFAULT_RESULT_TTL = Duration.ofHours(6);
	static final String DEFAULT_CACHE_DIRECTORY = "cache";

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	@ConditionalOnMissingBean(CacheStore.class)
	public CacheStore cacheStore(AppProperties properties, ObjectMapper objectMapper) {
		AppProperties.Cache cache = properties.cache();
		String store = cache == null || cache.store() == null ? "file" : cache.store().trim().toLowerCase(Locale.ROOT);
		if ("memory".equals(store)) {
			logger.info("Analysis cache store: in-memory.");
			return new InMemoryCacheStore();
		}
		if (!"file".equals(store)) {
			throw new IllegalStateException("Unknown cache store '" + cache.store() + "' (expected file or memory)");
		}
		String directory = cache == null || cache.directory() == null || cache.directory().isBlank()
				? DEFAULT_CACHE_DIRECTORY
				: cache.directory();
		Path root = Path.of(directory).toAbsolutePath();
		logger.info("Analysis cache store: files under {}.", root);
		return new FileCacheStore(root, objectMapper);
	}

	@Bean
	public AnalysisCache analysisCache(CacheStore cacheStore, ObjectMapper objectMapper, Clock clock, AppProperties properties) {
		AppProperties.Cache cache = properties.cache();
		Duration rawTtl = cache == null || cache.rawTtl() == null ? DEFAULT_RAW_TTL : cache.rawTtl();
		Duration resultTtl = cache == null || cache.resultTtl() == null ? DEFAULT_RESULT_TTL : cache.resultTtl();
		return new AnalysisCache(cacheStore, objectMapper, clock, rawTtl, resultTtl);
	}

	@Bean
	@ConditionalOnMissingBean(FinancialDataProvider.class)
	public FinancialDataProvider financialDataProvider(AppProperties properties, Clock clock) {
		AppProperties.Provider.Yahoo yahoo = properties.provider() == null ? null : properties.provider().yahoo();
		String baseUrl = yahoo == null ? null : yahoo.baseUrl();
		Integer connectTimeoutSeconds = yahoo == null ? null : yahoo.connectTimeoutSeconds();
		Integer readTimeoutSeconds = yahoo == null ? null : yahoo.readTimeoutSeconds();
		int connectTimeout = connectTimeoutSeconds == null ? 10 : Math.max(1, connectTimeoutSeconds);
		int readTimeout = readTimeoutSeconds == null ? 20 : Math.max(1, readTimeoutSeconds);
		return new YahooFinanceDataProvider(baseUrl, Duration.ofSeconds(connectTimeout), Duration.ofSeconds(readTimeout), clock);
	}

	@Bean
	public ScoringEngine scoringEngine(AppProperties properties) {
		return new ScoringEngine(curveOverrides(properties.scoring()));
	}

	@Bean
	public AnalysisPolicy analysisPolicy(AppProperties properties) {
		AppProperties.Provider provider = properties.provider();
		AppProperties.Analysis analysis = properties.analysis();
		int maxAttempts = provider == null || provider.maxAttempts() == null
				? AnalysisPolicy.DEFAULT_MAX_ATTEMPTS
				: provider.maxAttempts();
		long baseBackoff = provider == null || provider.baseBackoffMillis() == null
				? AnalysisPolicy.DEFAULT_BASE_BACKOFF_MILLIS
				: provider.baseBackoffMillis();
		long maxBackoff = provider == null || provider.maxBackoffMillis() == null
				? AnalysisPolicy.DEFAULT_MAX_BACKOFF_MILLIS
				: provider.maxBackoffMillis();
		boolean fallbackEnabled = analysis == null || analysis.fallbackEnabled() == null || analysis.fallbackEnabled();
		return new AnalysisPolicy(maxAttempts, baseBackoff, maxBackoff, fallbackEnabled, thresholds(analysis));
	}

	@Bean
	public RuleBasedFallbackAnalyzer ruleBasedFallbackAnalyzer(AnalysisPolicy policy, Clock clock) {
		return new RuleBasedFallbackAnalyzer(policy.thresholds(), clock);
	}

	private ActionThresholds thresholds(AppProperties.Analysis analysis) {
		AppProperties.Analysis.Thresholds thresholds = analysis == null ? null : analysis.thresholds();
		double buy = thresholds == null || thresholds.buy() == null ? ActionThresholds.DEFAULT_BUY : thresholds.buy();
		double sell = thresholds == null || thresholds.sell() == null ? ActionThresholds.DEFAULT_SELL : thresholds.sell();
		return new ActionThresholds(buy, sell);
	}

	static Map<Metric, ScoringCurve> curveOverrides(AppProperties.Scoring scoring) {
		Map<Metric, ScoringCurve> overrides = new EnumMap<>(Metric.class);
		if (scoring == null || scoring.curves() == null) {
			return overrides;
		}
		for (Map.Entry<String, List<ScoringCurve.Point>> entry : scoring.curves().entrySet()) {
			Metric metric = metricForKey(entry.getKey());
			overrides.put(metric, ScoringCurve.of(entry.getValue()));
			logger.info("Scoring curve override for {}: {}", metric, entry.getValue());
		}
		return overrides;
	}

	private static Metric metricForKey(String key) {
		for (Metric metric : Metric.values()) {
			if (metric.configKey().equalsIgnoreCase(key == null ? "" : key.trim())) {
				return metric;
			}
		}
		throw new IllegalStateException("Unknown metric in app.scoring.curves: " + key);
	}
}
