package offlinecache.domain.offline;

import jakarta.enterprise.context.ApplicationScoped;
import offlinecache.domain.exceptions.DatasetUnavailable;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves "name vN" for the Nth download, or fails for datasets marked as unreachable.
 */
@ApplicationScoped
public class FakeDatasetSource implements DatasetSource {
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final AtomicInteger fetches = new AtomicInteger();

    @Override
    public DatasetDownload fetch(final DatasetDescriptor dataset) {
        if (unreachable.contains(dataset.name())) {
            throw new DatasetUnavailable("Network unreachable for " + dataset.url());
        }

        final int fetch = fetches.incrementAndGet();
        return new DatasetDownload((dataset.name() + " v" + fetch).getBytes(StandardCharsets.UTF_8), "etag-" + fetch);
    }

    public void setUnreachable(final String name, final boolean isUnreachable) {
        if (isUnreachable) {
            unreachable.add(name);
        } else {
            unreachable.remove(name);
        }
    }

    public int getFetches() {
        return fetches.get();
    }
}
