package my.fundamentalagent.app.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Two-tier cache in front of the data provider (raw tier) and the whole analysis (result tier).
 * Reads never fail: missing, expired, unreadable or corrupt entries are reported as a miss, and a
 * failed write only costs the next request a recomputation.
 */
public class AnalysisCache {
	private static final Logger logger = LoggerFactory.getLogger(AnalysisCache.class);

	private final CacheStore store;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final Duration rawTtl;
	private final Duration resultTtl;

	public AnalysisCache(CacheStore store, ObjectMapper objectMapper, Clock clock, Duration rawTtl, Duration resultTtl) {
		this.store = store;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.rawTtl = requirePositive(rawTtl, "raw");
		this.resultTtl = requirePositive(resultTtl, "result");
		if (rawTtl.compareTo(resultTtl) < 0) {
			logger.warn("Raw cache TTL ({}) is shorter than result cache TTL ({}); cached results may outlive their inputs.",
					rawTtl, resultTtl);
		}
	}

	public <T> Optional<T> get(CacheKey key, Class<T> type) {
		Optional<CacheEntry<JsonNode>> stored;
		try {
			stored = store.read(key);
		} catch (CacheStorageException ex) {
			logger.warn("Cache read failed for {}: {}", key, ex.getMessage());
			return Optional.empty();
		}
		if (stored.isEmpty()) {
			return Optional.empty();
		}
		CacheEntry<JsonNode> entry = stored.get();
		Instant now = clock.instant();
		if (!entry.isValidAt(now)) {
			logger.debug("Cache entry {} expired at {}.", key, entry.expiresAt());
			return Optional.empty();
		}
		try {
			return Optional.of(objectMapper.treeToValue(entry.value(), type));
		} catch (Exception ex) {
			logger.warn("Cache entry {} could not be read as {}: {}", key, type.getSimpleName(), ex.getMessage());
			return Optional.empty();
		}
	}

	public void put(CacheKey key, Object value) {
		put(key, value, ttlFor(key.tier()));
	}

	public void put(CacheKey key, Object value, Duration ttl) {
		if (value == null) {
			throw new IllegalArgumentException("Cache value must not be null");
		}
		try {
			JsonNode tree = objectMapper.valueToTree(value);
			store.write(new CacheEntry<>(key, tree, clock.instant(), ttl));
		} catch (CacheStorageException ex) {
			logger.warn("Cache write failed for {}: {}", key, ex.getMessage());
		}
	}

	public Duration ttlFor(CacheTier tier) {
		return tier == CacheTier.RAW ? rawTtl : resultTtl;
	}

	private static Duration requirePositive(Duration ttl, String tier) {
		if (ttl == null || ttl.isZero() || ttl.isNegative()) {
			throw new IllegalArgumentException("The " + tier + " cache TTL must be positive: " + ttl);
		}
		return ttl;
	}
}
