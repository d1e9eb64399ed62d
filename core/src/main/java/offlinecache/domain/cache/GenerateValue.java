package offlinecache.domain.cache;

import org.jspecify.annotations.Nullable;

/**
 * Produces a value on a cache miss. Returning null skips the store.
 */
public interface GenerateValue<T> {
    @Nullable
    T generate();
}
