package offlinecache.domain.management;

/**
 * The single state shown to the user in place of raw error text.
 */
public enum StatusIndicator {
    ONLINE("online"),
    OFFLINE("offline"),
    SYNCING("syncing"),
    CACHED("cached"),
    ERROR("error");

    private final String label;

    StatusIndicator(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
