package offlinecache.domain.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * Storage held entirely in memory. Contents live as long as the container.
 * Used when no persistent area is wanted, and by tests.
 */
@ApplicationScoped
public class InMemoryStorageCapabilities implements StorageCapabilities {

    @Inject
    private Clock clock;

    private final MemoryDirectory root = new MemoryDirectory("");

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public StorageDirectory openRoot() {
        return root;
    }

    /**
     * Files and directories are kept apart, as they are on disk where file names are encoded.
     */
    private final class MemoryDirectory implements StorageDirectory {
        private final String name;
        private final Map<String, MemoryDirectory> directories = new ConcurrentSkipListMap<>();
        private final Map<String, MemoryFile> files = new ConcurrentSkipListMap<>();

        MemoryDirectory(final String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<StorageDirectory> directory(final String name) {
            return Optional.ofNullable(directories.get(name));
        }

        @Override
        public StorageDirectory createDirectory(final String name) {
            return directories.computeIfAbsent(name, MemoryDirectory::new);
        }

        @Override
        public Optional<StorageFile> file(final String name) {
            return Optional.ofNullable(files.get(name));
        }

        @Override
        public StorageWritable openWritable(final String name) {
            return new MemoryWritable(this, name);
        }

        @Override
        public boolean removeFile(final String name) {
            return files.remove(name) != null;
        }

        @Override
        public List<StorageHandle> entries() {
            return Stream.concat(directories.values().stream(), files.values().stream())
                    .map(StorageHandle.class::cast)
                    .toList();
        }

        void commit(final String name, final byte[] data) {
            files.put(name, new MemoryFile(name, data, clock.millis()));
        }
    }

    private record MemoryFile(String name, byte[] data, long lastModified) implements StorageFile {
        @Override
        public long size() {
            return data.length;
        }

        @Override
        public String contentType() {
            return ContentTypes.of(name);
        }

        @Override
        public byte[] readAllBytes() {
            return Arrays.copyOf(data, data.length);
        }
    }

    private static final class MemoryWritable implements StorageWritable {
        private final MemoryDirectory parent;
        private final String name;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private boolean finished;

        MemoryWritable(final MemoryDirectory parent, final String name) {
            this.parent = parent;
            this.name = name;
        }

        @Override
        public void write(final byte[] data) {
            buffer.writeBytes(data);
        }

        @Override
        public void close() {
            if (finished) {
                return;
            }
            finished = true;
            parent.commit(name, buffer.toByteArray());
        }

        @Override
        public void abort() {
            finished = true;
            buffer.reset();
        }
    }
}
