package offlinecache.domain.storage;

import java.util.Arrays;
import java.util.Optional;

/**
 * The top-level areas of the sandbox. Each has its own lifetime policy.
 */
public enum Partition {
    /**
     * Downloaded datasets. Never evicted automatically.
     */
    DATASETS("datasets"),
    /**
     * Cached query results and other derived data. Subject to TTLs and LRU eviction.
     */
    CACHE("cache"),
    /**
     * Scratch space, emptied by cleanup.
     */
    TEMPORARY("temporary");

    private final String directoryName;

    Partition(final String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    public static Optional<Partition> fromDirectoryName(final String name) {
        return Arrays.stream(values())
                .filter(partition -> partition.directoryName.equalsIgnoreCase(name))
                .findFirst();
    }
}
