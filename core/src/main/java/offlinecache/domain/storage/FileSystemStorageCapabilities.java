package offlinecache.domain.storage;

import com.google.common.net.PercentEscaper;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.exceptions.StorageIOFailure;
import offlinecache.domain.exceptions.StorageNotFound;
import offlinecache.domain.exceptions.UnsupportedEnvironment;
import offlinecache.domain.storage.config.StorageRoot;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage rooted at a local directory.
 * <p>
 * File names are percent-encoded so any key maps to a single path segment, and an encoded name never
 * starts with a dot. Dot-prefixed files are in-flight writes and are hidden from listings.
 * Writes land in one of those hidden files and are moved over the target on commit.
 */
@ApplicationScoped
public class FileSystemStorageCapabilities implements StorageCapabilities {
    private static final PercentEscaper ESCAPER = new PercentEscaper("-_.~", false);
    private static final String STAGING_PREFIX = ".";
    private static final String STAGING_SUFFIX = ".partial";
    private static final Logger LOGGER = Logger.getLogger(FileSystemStorageCapabilities.class.getName());

    @Inject
    private StorageRoot storageRoot;

    @Inject
    private Logger logger;

    @Override
    public boolean isSupported() {
        final Path root = storageRoot.getRoot();
        return Try.of(() -> Files.createDirectories(root))
                .map(Files::isWritable)
                .onFailure(ex -> logger.warning("Storage root " + root + " is not usable: " + ex.getMessage()))
                .getOrElse(false);
    }

    @Override
    public StorageDirectory openRoot() {
        if (!isSupported()) {
            throw new UnsupportedEnvironment("Storage root " + storageRoot.getRoot().toAbsolutePath() + " can not be used as a writable directory");
        }

        return new FileSystemDirectory(storageRoot.getRoot().toAbsolutePath().normalize());
    }

    static String encodeName(final String name) {
        final String escaped = ESCAPER.escape(name);
        return escaped.startsWith(".") ? "%2E" + escaped.substring(1) : escaped;
    }

    static String decodeName(final String name) {
        return URLDecoder.decode(name, StandardCharsets.UTF_8);
    }

    private record FileSystemDirectory(Path path) implements StorageDirectory {

        @Override
        public String name() {
            return path.getFileName() == null ? "" : path.getFileName().toString();
        }

        @Override
        public Optional<StorageDirectory> directory(final String name) {
            final Path child = path.resolve(name);
            return Files.isDirectory(child)
                    ? Optional.of(new FileSystemDirectory(child))
                    : Optional.empty();
        }

        @Override
        public StorageDirectory createDirectory(final String name) {
            final Path child = path.resolve(name);
            return Try.of(() -> Files.createDirectories(child))
                    .<StorageDirectory>map(FileSystemDirectory::new)
                    .getOrElseThrow(ex -> new StorageIOFailure("Failed to create directory " + child, ex));
        }

        @Override
        public Optional<StorageFile> file(final String name) {
            final Path child = path.resolve(encodeName(name));
            return Files.isRegularFile(child)
                    ? Optional.of(new FileSystemFile(child))
                    : Optional.empty();
        }

        @Override
        public StorageWritable openWritable(final String name) {
            final Path target = path.resolve(encodeName(name));
            final Path staging = path.resolve(STAGING_PREFIX + UUID.randomUUID() + STAGING_SUFFIX);
            return new FileSystemWritable(target, staging);
        }

        @Override
        public boolean removeFile(final String name) {
            final Path file = path.resolve(encodeName(name));
            if (!Files.isRegularFile(file)) {
                return false;
            }

            return Try.of(() -> Files.deleteIfExists(file))
                    .getOrElseThrow(ex -> new StorageIOFailure("Failed to delete " + file, ex));
        }

        @Override
        public List<StorageHandle> entries() {
            if (!Files.isDirectory(path)) {
                return List.of();
            }

            return Try.withResources(() -> Files.list(path))
                    .of(this::toHandles)
                    .getOrElseThrow(ex -> new StorageIOFailure("Failed to list " + path, ex));
        }

        private List<StorageHandle> toHandles(final Stream<Path> children) {
            return children
                    .filter(child -> !(Files.isRegularFile(child) && child.getFileName().toString().startsWith(STAGING_PREFIX)))
                    .filter(child -> Files.isDirectory(child) || hasDecodableName(child))
                    .<StorageHandle>map(child -> Files.isDirectory(child)
                            ? new FileSystemDirectory(child)
                            : new FileSystemFile(child))
                    .collect(Collectors.toList());
        }
    }

    private static boolean hasDecodableName(final Path file) {
        return Try.of(() -> decodeName(file.getFileName().toString()))
                .onFailure(ex -> LOGGER.warning("Skipping " + file + ", its name is not an encoded key"))
                .isSuccess();
    }

    private record FileSystemFile(Path path) implements StorageFile {

        @Override
        public String name() {
            return decodeName(path.getFileName().toString());
        }

        @Override
        public long size() {
            return Try.of(() -> Files.size(path))
                    .getOrElseThrow(ex -> mapFailure(ex));
        }

        @Override
        public long lastModified() {
            return Try.of(() -> Files.getLastModifiedTime(path).toMillis())
                    .getOrElseThrow(ex -> mapFailure(ex));
        }

        @Override
        public String contentType() {
            return ContentTypes.of(name());
        }

        @Override
        public byte[] readAllBytes() {
            return Try.of(() -> FileUtils.readFileToByteArray(path.toFile()))
                    .getOrElseThrow(ex -> mapFailure(ex));
        }

        private RuntimeException mapFailure(final Throwable ex) {
            if (ex instanceof NoSuchFileException) {
                return new StorageNotFound(path.toString(), ex);
            }

            return new StorageIOFailure("Failed to read " + path, ex);
        }
    }

    private static class FileSystemWritable implements StorageWritable {
        private final Path target;
        private final Path staging;
        private boolean finished;

        FileSystemWritable(final Path target, final Path staging) {
            this.target = target;
            this.staging = staging;
        }

        @Override
        public void write(final byte[] data) {
            Try.run(() -> Files.write(staging, data, StandardOpenOption.CREATE, StandardOpenOption.APPEND))
                    .getOrElseThrow(ex -> new StorageIOFailure("Failed to write " + target, ex));
        }

        @Override
        public void close() {
            if (finished) {
                return;
            }
            finished = true;

            Try.run(() -> {
                        if (!Files.exists(staging)) {
                            Files.createFile(staging);
                        }
                    })
                    .andThenTry(this::commit)
                    .onFailure(ex -> discardStaging())
                    .getOrElseThrow(ex -> new StorageIOFailure("Failed to commit " + target, ex));
        }

        private void commit() throws IOException {
            try {
                Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException ex) {
                Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        @Override
        public void abort() {
            finished = true;
            discardStaging();
        }

        private void discardStaging() {
            Try.run(() -> Files.deleteIfExists(staging))
                    .onFailure(ex -> LOGGER.warning("Failed to discard staging file " + staging + ": " + ex.getMessage()));
        }
    }
}
