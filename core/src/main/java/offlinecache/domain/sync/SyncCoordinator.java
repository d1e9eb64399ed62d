package offlinecache.domain.sync;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import offlinecache.domain.cache.config.CacheCleanupInterval;
import offlinecache.domain.connectivity.ConnectivityChanged;
import offlinecache.domain.connectivity.ConnectivityMonitor;
import offlinecache.domain.exceptionhandling.ExceptionHandler;
import offlinecache.domain.exceptionhandling.ExceptionMapping;
import offlinecache.domain.exceptions.ExternalFailure;
import offlinecache.domain.exceptions.InternalFailure;
import offlinecache.domain.exceptions.TaskFailure;
import offlinecache.domain.exceptions.UnknownTask;
import offlinecache.domain.sync.config.SyncAutorun;
import offlinecache.domain.sync.config.SyncCompletedLimit;
import offlinecache.domain.timing.TimedOperation;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Queues reconciliation work and runs it one task at a time in creation order.
 * <p>
 * A failed task is recorded with its error and the runner moves on to the next one. Failed tasks are
 * never retried automatically; {@link #retry(String)} queues a fresh copy. While offline, tasks stay
 * queued. Coming back online queues a cache revalidation and resumes the runner.
 * <p>
 * With autorun enabled the queue is drained on a background thread as tasks arrive. Otherwise
 * {@link #processQueue()} drains it on the calling thread. Either way an expiry sweep is queued at the
 * configured cleanup interval.
 */
@ApplicationScoped
public class SyncCoordinator {
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    @Inject
    private Instance<SyncTaskHandler> handlers;

    @Inject
    private ConnectivityMonitor connectivityMonitor;

    @Inject
    private SyncAutorun syncAutorun;

    @Inject
    private SyncCompletedLimit syncCompletedLimit;

    @Inject
    private CacheCleanupInterval cacheCleanupInterval;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Event<SyncTaskEvent> taskEvents;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    /**
     * Guards tasks and queue.
     */
    private final Object lock = new Object();

    private final Map<String, SyncTask> tasks = new LinkedHashMap<>();

    private final Deque<String> queue = new ArrayDeque<>();

    private final ReentrantLock runner = new ReentrantLock();

    private final AtomicLong sequence = new AtomicLong();

    @Nullable
    private ScheduledExecutorService executor;

    @PostConstruct
    private void init() {
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "offlinecache-sync");
            thread.setDaemon(true);
            return thread;
        });

        cacheCleanupInterval.getInterval().ifPresent(interval -> {
            final long millis = interval.toMillis();
            executor.scheduleAtFixedRate(this::queueCleanup, millis, millis, TimeUnit.MILLISECONDS);
            logger.fine("Expired entries are swept every " + interval);
        });
    }

    @PreDestroy
    private void destroy() {
        if (executor != null) {
            executor.shutdown();
            Try.of(() -> executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS))
                    .filter(terminated -> terminated)
                    .onFailure(ex -> logger.warning("Sync runner did not stop within " + SHUTDOWN_WAIT_SECONDS + " seconds"));
        }
    }

    public SyncTask enqueue(final SyncTaskKind kind) {
        return enqueue(kind, null);
    }

    /**
     * Queues a task. Never blocks on running work.
     */
    public SyncTask enqueue(final SyncTaskKind kind, @Nullable final String target) {
        final SyncTask task;
        synchronized (lock) {
            task = addPending(kind, target);
        }

        queued(task);
        return task;
    }

    /**
     * Queues a task unless one of the same kind and target is already waiting.
     *
     * @return the waiting task, or the newly queued one
     */
    public SyncTask enqueueIfAbsent(final SyncTaskKind kind, @Nullable final String target) {
        final SyncTask task;
        synchronized (lock) {
            final Optional<SyncTask> waiting = queue.stream()
                    .map(tasks::get)
                    .filter(queued -> queued.kind() == kind && Objects.equals(queued.target(), target))
                    .findFirst();
            if (waiting.isPresent()) {
                return waiting.get();
            }

            task = addPending(kind, target);
        }

        queued(task);
        return task;
    }

    /**
     * Queues a task and makes sure the runner picks it up, on this thread when autorun is disabled.
     */
    public SyncTask requestSync(final SyncTaskKind kind, @Nullable final String target) {
        final SyncTask task = enqueue(kind, target);

        if (!syncAutorun.isAutorun()) {
            processQueue();
        }

        return task;
    }

    public SyncTask syncNow() {
        return requestSync(SyncTaskKind.REVALIDATE_CACHE, null);
    }

    /**
     * Runs pending tasks until the queue is empty or the host goes offline. Returns at once if another
     * thread is already running tasks.
     *
     * @return the number of tasks run by this call
     */
    public int processQueue() {
        int processed = 0;

        while (runner.tryLock()) {
            try {
                processed += drain();
            } finally {
                runner.unlock();
            }

            // A task queued after the last poll but before the unlock would otherwise wait for the next trigger
            if (!hasRunnableTasks()) {
                break;
            }
        }

        return processed;
    }

    /**
     * Queues a new copy of a failed task.
     */
    public SyncTask retry(final String taskId) {
        final SyncTask original = task(taskId)
                .orElseThrow(() -> new UnknownTask("No task with id " + taskId));

        if (original.status() != SyncTaskStatus.FAILED) {
            throw new InternalFailure("Task " + taskId + " is " + original.status() + ", only failed tasks can be retried");
        }

        logger.info("Retrying " + original.kind().label() + " task " + taskId);
        return requestSync(original.kind(), original.target());
    }

    /**
     * Forgets completed and failed tasks. Pending and running tasks are untouched.
     *
     * @return the number of tasks removed
     */
    public int clearCompletedTasks() {
        final int removed;
        synchronized (lock) {
            final int before = tasks.size();
            tasks.values().removeIf(task -> task.status().isTerminal());
            removed = before - tasks.size();
        }

        logger.info("Cleared " + removed + " finished sync tasks");
        return removed;
    }

    public SyncStatus getSyncStatus() {
        synchronized (lock) {
            return new SyncStatus(
                    count(SyncTaskStatus.PENDING),
                    count(SyncTaskStatus.RUNNING),
                    count(SyncTaskStatus.COMPLETED),
                    count(SyncTaskStatus.FAILED));
        }
    }

    /**
     * @return every known task, oldest first
     */
    public List<SyncTask> tasks() {
        synchronized (lock) {
            return List.copyOf(tasks.values());
        }
    }

    public Optional<SyncTask> task(final String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(taskId));
        }
    }

    public void onConnectivityChanged(@Observes final ConnectivityChanged event) {
        if (event.online()) {
            logger.info("Back online, revalidating the cache");
            enqueue(SyncTaskKind.REVALIDATE_CACHE);
        } else {
            logger.info("Offline, " + getSyncStatus().pending() + " sync tasks will wait for the connection");
        }
    }

    private int drain() {
        int processed = 0;
        while (connectivityMonitor.isOnline()) {
            final Optional<SyncTask> next = startNext();
            if (next.isEmpty()) {
                break;
            }

            run(next.get());
            processed++;
        }

        return processed;
    }

    private Optional<SyncTask> startNext() {
        final SyncTask started;
        synchronized (lock) {
            final String id = queue.pollFirst();
            if (id == null) {
                return Optional.empty();
            }

            started = tasks.get(id).running(clock.millis());
            tasks.put(id, started);
        }

        taskEvents.fire(new SyncTaskEvent(started));
        return Optional.of(started);
    }

    private void run(final SyncTask task) {
        final SyncTask finished;
        try (TimedOperation ignored = new TimedOperation("sync task " + task.id() + " (" + task.kind().label() + ")")) {
            finished = exceptionMapping.map(Try.run(() -> handlerFor(task.kind()).execute(task)))
                    .map(success -> task.completed(clock.millis()))
                    .recover(ex -> task.failed(clock.millis(), exceptionHandler.getExceptionMessage(ex), ex instanceof ExternalFailure))
                    .get();
        }

        if (finished.status() == SyncTaskStatus.FAILED) {
            logger.warning("Sync task " + task.id() + " (" + task.kind().label() + ") failed: " + finished.error());
        } else {
            logger.fine("Sync task " + task.id() + " (" + task.kind().label() + ") completed");
        }

        synchronized (lock) {
            // The task stays registered while running, so this cannot resurrect a cleared task
            tasks.put(task.id(), finished);
            trimFinished();
        }

        taskEvents.fire(new SyncTaskEvent(finished));
    }

    private SyncTaskHandler handlerFor(final SyncTaskKind kind) {
        return handlers.stream()
                .filter(handler -> handler.supports(kind))
                .findFirst()
                .orElseThrow(() -> new TaskFailure("No handler for " + kind.label() + " tasks"));
    }

    /**
     * Drops the oldest finished tasks beyond the configured limit. Called with the lock held.
     */
    private void trimFinished() {
        final int limit = syncCompletedLimit.getLimit();
        if (limit <= 0) {
            return;
        }

        final List<String> finished = tasks.values().stream()
                .filter(task -> task.status().isTerminal())
                .map(SyncTask::id)
                .toList();

        finished.stream()
                .limit(Math.max(0, finished.size() - limit))
                .forEach(tasks::remove);
    }

    private int count(final SyncTaskStatus status) {
        return (int) tasks.values().stream()
                .filter(task -> task.status() == status)
                .count();
    }

    private boolean hasRunnableTasks() {
        synchronized (lock) {
            return !queue.isEmpty() && connectivityMonitor.isOnline();
        }
    }

    /**
     * Called with the lock held.
     */
    private SyncTask addPending(final SyncTaskKind kind, @Nullable final String target) {
        final SyncTask task = SyncTask.pending("task-" + sequence.incrementAndGet(), kind, target, clock.millis());
        tasks.put(task.id(), task);
        queue.addLast(task.id());
        return task;
    }

    private void queued(final SyncTask task) {
        logger.fine("Queued " + task.kind().label() + " task " + task.id());
        taskEvents.fire(new SyncTaskEvent(task));

        if (syncAutorun.isAutorun()) {
            scheduleRunner();
        }
    }

    private void queueCleanup() {
        Try.run(() -> enqueueIfAbsent(SyncTaskKind.EVICT_EXPIRED, null))
                .onFailure(ex -> logger.warning("Failed to queue the periodic cleanup: " + ex.getMessage()));
    }

    private void scheduleRunner() {
        if (executor == null || executor.isShutdown()) {
            logger.warning("Sync runner is not available, tasks stay queued");
            return;
        }

        Try.run(() -> executor.submit(this::processQueue))
                .onFailure(ex -> logger.warning("Failed to schedule the sync runner: " + ex.getMessage()));
    }
}
