package my.fundamentalagent.app.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<T>(CacheKey key, T value, Instant storedAt, Duration ttl) {
	public CacheEntry {
		if (key == null || storedAt == null || ttl == null) {
			throw new IllegalArgumentException("Cache entry requires key, storedAt and ttl");
		}
		if (ttl.isNegative()) {
			throw new IllegalArgumentException("Cache TTL must not be negative: " + ttl);
		}
	}

	public Instant expiresAt() {
		return storedAt.plus(ttl);
	}

	/** Valid while {@code now - storedAt < ttl}. */
	public boolean isValidAt(Instant now) {
		return Duration.between(storedAt, now).compareTo(ttl) < 0;
	}
}
