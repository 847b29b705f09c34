package my.fundamentalagent.app.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Backing storage for both cache tiers. Values are stored as JSON trees; expiry is decided by
 * {@link AnalysisCache}, not by the store. Stores never remove entries on their own: an expired
 * entry stays until a later write for the same key replaces it.
 */
public interface CacheStore {
	Optional<CacheEntry<JsonNode>> read(CacheKey key);

	/** Replaces any previous entry for the same key as a whole. */
	void write(CacheEntry<JsonNode> entry);
}
