package my.fundamentalagent.app.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import my.fundamentalagent.app.model.InvestorStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Stores one JSON document per entry under {@code <root>/<tier>/}. Writes land in a temporary file in
 * the target directory and are then renamed over the entry, so a reader sees either the previous or
 * the new document.
 */
public class FileCacheStore implements CacheStore {
	private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);
	private static final String TEMP_SUFFIX = ".tmp";

	private final Path root;
	private final ObjectMapper objectMapper;

	public FileCacheStore(Path root, ObjectMapper objectMapper) {
		if (root == null) {
			throw new IllegalArgumentException("Cache directory is required");
		}
		this.root = root;
		this.objectMapper = objectMapper;
	}

	public Path root() {
		return root;
	}

	Path pathFor(CacheKey key) {
		return root.resolve(key.tier().value()).resolve(key.fileName());
	}

	@Override
	public Optional<CacheEntry<JsonNode>> read(CacheKey key) {
		Path path = pathFor(key);
		byte[] bytes;
		try {
			bytes = Files.readAllBytes(path);
		} catch (NoSuchFileException ex) {
			return Optional.empty();
		} catch (IOException ex) {
			throw new CacheStorageException("Failed to read cache entry " + path, ex);
		}
		JsonNode document;
		try {
			document = objectMapper.readTree(bytes);
		} catch (IOException ex) {
			throw new CacheStorageException("Corrupt cache entry " + path, ex);
		}
		CacheEntry<JsonNode> entry = parse(document, path);
		if (!entry.key().equals(key)) {
			logger.warn("Cache entry {} belongs to {}, expected {}; ignoring.", path, entry.key(), key);
			return Optional.empty();
		}
		return Optional.of(entry);
	}

	@Override
	public void write(CacheEntry<JsonNode> entry) {
		Path target = pathFor(entry.key());
		Path temp = null;
		try {
			Files.createDirectories(target.getParent());
			temp = Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", TEMP_SUFFIX);
			Files.write(temp, objectMapper.writeValueAsBytes(toDocument(entry)));
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
			temp = null;
		} catch (IOException ex) {
			throw new CacheStorageException("Failed to write cache entry " + target, ex);
		} finally {
			if (temp != null) {
				try {
					Files.deleteIfExists(temp);
				} catch (IOException ex) {
					logger.debug("Failed to remove temporary cache file {}: {}", temp, ex.getMessage());
				}
			}
		}
	}

	private ObjectNode toDocument(CacheEntry<JsonNode> entry) {
		CacheKey key = entry.key();
		ObjectNode document = objectMapper.createObjectNode();
		document.put("tier", key.tier().value());
		document.put("ticker", key.ticker());
		if (key.style() != null) {
			document.put("style", key.style().value());
		}
		document.put("day", key.day().toString());
		document.put("storedAt", entry.storedAt().toString());
		document.put("ttlMillis", entry.ttl().toMillis());
		document.put("expiresAt", entry.expiresAt().toString());
		document.set("value", entry.value());
		return document;
	}

	private CacheEntry<JsonNode> parse(JsonNode document, Path path) {
		try {
			String tierValue = requiredText(document, "tier");
			CacheTier tier = null;
			for (CacheTier candidate : CacheTier.values()) {
				if (candidate.value().equals(tierValue)) {
					tier = candidate;
				}
			}
			if (tier == null) {
				throw new IllegalArgumentException("Unknown tier " + tierValue);
			}
			String styleValue = document.path("style").asText(null);
			InvestorStyle style = styleValue == null ? null : InvestorStyle.fromValue(styleValue);
			CacheKey key = new CacheKey(tier, requiredText(document, "ticker"), style,
					LocalDate.parse(requiredText(document, "day")));
			Instant storedAt = Instant.parse(requiredText(document, "storedAt"));
			JsonNode ttlMillis = document.get("ttlMillis");
			if (ttlMillis == null || !ttlMillis.canConvertToLong()) {
				throw new IllegalArgumentException("Missing ttlMillis");
			}
			JsonNode value = document.get("value");
			if (value == null || value.isNull()) {
				throw new IllegalArgumentException("Missing value");
			}
			return new CacheEntry<>(key, value, storedAt, Duration.ofMillis(ttlMillis.asLong()));
		} catch (RuntimeException ex) {
			throw new CacheStorageException("Corrupt cache entry " + path + ": " + ex.getMessage(), ex);
		}
	}

	private static String requiredText(JsonNode document, String field) {
		JsonNode node = document.get(field);
		if (node == null || !node.isTextual() || node.asText().isBlank()) {
			throw new IllegalArgumentException("Missing " + field);
		}
		return node.asText();
	}
}
