package offlinecache.domain.mutex;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.exceptions.LockFail;
import offlinecache.domain.mutex.config.MutexTimeout;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An in-process mutex with one lock per name. Operations on different names never block each other.
 * The locks are reentrant, so a callback may acquire its own name again.
 * <p>
 * Locks are weakly held and disappear once no thread holds or waits on them.
 */
@ApplicationScoped
public class KeyedMutex implements Mutex {
    private final LoadingCache<String, ReentrantLock> locks = CacheBuilder.newBuilder()
            .weakValues()
            .build(CacheLoader.from(() -> new ReentrantLock()));

    @Inject
    private MutexTimeout mutexTimeout;

    @Override
    public <T> T acquire(final String lockName, final MutexCallback<T> callback) {
        return acquire(mutexTimeout.getTimeout(), lockName, callback);
    }

    @Override
    public <T> T acquire(final long timeout, final String lockName, final MutexCallback<T> callback) {
        final ReentrantLock lock = locks.getUnchecked(lockName);

        return Try.of(() -> lock.tryLock(timeout, TimeUnit.MILLISECONDS))
                .onFailure(InterruptedException.class, ex -> Thread.currentThread().interrupt())
                .filter(acquired -> acquired)
                .mapFailure(API.Case(API.$(), ex -> new LockFail("Failed to obtain lock " + lockName + " within " + timeout + " ms", ex)))
                .map(acquired -> callback.apply())
                .andFinally(() -> {
                    if (lock.isHeldByCurrentThread()) {
                        lock.unlock();
                    }
                })
                .get();
    }
}
