package offlinecache.domain.connectivity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Holds the network state reported by the host. Starts online.
 */
@ApplicationScoped
public class ConnectivityMonitor {

    @Inject
    private Event<ConnectivityChanged> connectivityEvents;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    private final AtomicBoolean online = new AtomicBoolean(true);

    public boolean isOnline() {
        return online.get();
    }

    /**
     * Records the new state and fires {@link ConnectivityChanged} if it differs from the old one.
     */
    public void setOnline(final boolean isOnline) {
        if (online.compareAndSet(!isOnline, isOnline)) {
            logger.info(isOnline ? "Connection restored" : "Connection lost");
            connectivityEvents.fire(new ConnectivityChanged(isOnline, clock.millis()));
        }
    }
}
