package offlinecache.domain.connectivity;

/**
 * Fired when the host goes online or offline.
 */
public record ConnectivityChanged(boolean online, long changedAt) {
}
