package offlinecache.domain.cache;

import offlinecache.domain.storage.Partition;

public record GetOptions(Partition partition) {
    public static GetOptions defaults() {
        return new GetOptions(Partition.CACHE);
    }

    public static GetOptions in(final Partition partition) {
        return new GetOptions(partition);
    }
}
