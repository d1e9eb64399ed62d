package offlinecache.domain.sync;

/**
 * Task counts by state.
 */
public record SyncStatus(int pending, int running, int completed, int failed) {
    public int total() {
        return pending + running + completed + failed;
    }
}
