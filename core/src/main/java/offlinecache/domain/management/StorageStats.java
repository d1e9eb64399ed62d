package offlinecache.domain.management;

import offlinecache.domain.storage.Partition;

import java.util.Map;

public record StorageStats(long totalBytes,
                           Map<Partition, Long> perDirectoryBytes,
                           int datasetCount,
                           int cacheEntryCount) {
}
