package offlinecache.domain.date;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Clock;

/**
 * Supplies the clock used for timestamps, TTLs and task bookkeeping.
 */
@ApplicationScoped
public class SystemClockProducer {
    @Produces
    public Clock clock() {
        return Clock.systemUTC();
    }
}
