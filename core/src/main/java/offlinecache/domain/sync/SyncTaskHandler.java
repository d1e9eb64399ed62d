package offlinecache.domain.sync;

/**
 * Executes tasks of one kind. Throwing marks the task as failed.
 */
public interface SyncTaskHandler {
    boolean supports(SyncTaskKind kind);

    void execute(SyncTask task);
}
