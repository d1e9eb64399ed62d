package offlinecache.domain.metadata;

import offlinecache.domain.storage.Partition;

public record EntryKey(Partition partition, String path) {
}
