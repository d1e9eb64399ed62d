package offlinecache.domain.cache;

import org.jspecify.annotations.Nullable;

/**
 * A value and whether it came from the cache or was freshly generated.
 */
public record CacheResult<T>(@Nullable T result, boolean fromCache) {
}
