package offlinecache.domain.offline;

import java.util.List;

public record OfflineStatus(boolean online, List<DatasetStatus> datasets, long totalBytes) {
    public long availableCount() {
        return datasets.stream().filter(DatasetStatus::availableOffline).count();
    }
}
