package offlinecache.domain.sync;

public enum SyncTaskKind {
    REFRESH_DATASET("refresh-dataset"),
    REVALIDATE_CACHE("revalidate-cache"),
    EVICT_EXPIRED("evict-expired");

    private final String label;

    SyncTaskKind(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
