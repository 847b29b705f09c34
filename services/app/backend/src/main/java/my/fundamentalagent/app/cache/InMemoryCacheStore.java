package my.fundamentalagent.app.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCacheStore implements CacheStore {
	private final Map<CacheKey, CacheEntry<JsonNode>> entries = new ConcurrentHashMap<>();

	@Override
	public Optional<CacheEntry<JsonNode>> read(CacheKey key) {
		CacheEntry<JsonNode> entry = entries.get(key);
		if (entry == null) {
			return Optional.empty();
		}
		return Optional.of(new CacheEntry<>(entry.key(), entry.value().deepCopy(), entry.storedAt(), entry.ttl()));
	}

	@Override
	public void write(CacheEntry<JsonNode> entry) {
		entries.put(entry.key(), new CacheEntry<>(entry.key(), entry.value().deepCopy(), entry.storedAt(), entry.ttl()));
	}

	public int size() {
		return entries.size();
	}
}
