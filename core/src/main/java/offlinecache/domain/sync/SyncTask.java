package offlinecache.domain.sync;

import org.jspecify.annotations.Nullable;

/**
 * One unit of reconciliation work. Instances are immutable; each state change produces a new one.
 *
 * @param target           what the task applies to, such as a dataset name, or null for everything
 * @param error            the failure message of a failed task
 * @param transientFailure true if the failure may go away when the task is retried
 */
public record SyncTask(String id,
                       SyncTaskKind kind,
                       @Nullable String target,
                       long createdAt,
                       SyncTaskStatus status,
                       @Nullable Long startedAt,
                       @Nullable Long completedAt,
                       @Nullable String error,
                       boolean transientFailure) {

    public static SyncTask pending(final String id, final SyncTaskKind kind, @Nullable final String target, final long createdAt) {
        return new SyncTask(id, kind, target, createdAt, SyncTaskStatus.PENDING, null, null, null, false);
    }

    public SyncTask running(final long now) {
        return new SyncTask(id, kind, target, createdAt, SyncTaskStatus.RUNNING, now, null, null, false);
    }

    public SyncTask completed(final long now) {
        return new SyncTask(id, kind, target, createdAt, SyncTaskStatus.COMPLETED, startedAt, now, null, false);
    }

    public SyncTask failed(final long now, final String error, final boolean transientFailure) {
        return new SyncTask(id, kind, target, createdAt, SyncTaskStatus.FAILED, startedAt, now, error, transientFailure);
    }
}
