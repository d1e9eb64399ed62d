package offlinecache.domain.sync;

/**
 * Fired whenever a task is queued or changes state.
 */
public record SyncTaskEvent(SyncTask task) {
}
