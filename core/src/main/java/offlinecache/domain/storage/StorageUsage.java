package offlinecache.domain.storage;

import java.util.Map;

public record StorageUsage(Map<Partition, Long> bytesByPartition, long totalBytes) {
    public String formattedTotal() {
        return SizeFormatter.format(totalBytes);
    }

    public String formatted(final Partition partition) {
        return SizeFormatter.format(bytesByPartition.getOrDefault(partition, 0L));
    }
}
