package offlinecache.domain.mutex;

/**
 * Represents a named mutex lock.
 */
public interface Mutex {
    <T> T acquire(long timeout, String lockName, MutexCallback<T> callback);

    <T> T acquire(String lockName, MutexCallback<T> callback);
}
