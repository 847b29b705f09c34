package my.fundamentalagent.app.cache;

/**
 * Raised by a {@link CacheStore} when the backing storage cannot be read or written. Never reaches
 * callers of {@link AnalysisCache}, which degrade to a cache miss.
 */
public class CacheStorageException extends RuntimeException {
	public CacheStorageException(String message, Throwable cause) {
		super(message, cause);
	}
}
