package offlinecache.domain.offline;

import org.jspecify.annotations.Nullable;

public record DatasetStatus(String name,
                            boolean availableOffline,
                            @Nullable Long lastUpdated,
                            long size,
                            boolean stale) {
}
