package offlinecache.domain.storage;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Capability-checked access to the sandboxed file area. Every operation other than
 * {@link #checkSupport()} and {@link #formatSize(long)} requires {@link #initialize()} to have succeeded
 * and throws StorageNotInitialized otherwise.
 */
public interface StorageBackend {
    /**
     * @return true if the host provides the hierarchical storage this backend needs
     */
    boolean checkSupport();

    /**
     * Opens the root and creates the partitions. Calling it again is a no-op.
     *
     * @throws offlinecache.domain.exceptions.UnsupportedEnvironment if the host has no usable storage
     */
    void initialize();

    boolean isInitialized();

    /**
     * Writes the full payload without attributes. Attributes left by an earlier write are dropped.
     * Readers see either the previous content or the new content, never a mix.
     */
    void write(Partition partition, String path, byte[] payload);

    /**
     * Writes the full payload together with its attributes. If the payload can not be committed the
     * previous payload and attributes are left in place.
     */
    void write(Partition partition, String path, byte[] payload, @Nullable EntryAttributes attributes);

    /**
     * @return the content in the requested form, or empty if the path does not exist
     */
    <T> Optional<T> read(Partition partition, String path, ReadMode<T> mode);

    boolean exists(Partition partition, String path);

    /**
     * @return false if the path was already absent
     */
    boolean remove(Partition partition, String path);

    /**
     * Lists the files of a partition. Nested directories are skipped.
     */
    List<StoredFileInfo> list(Partition partition);

    Optional<EntryAttributes> readAttributes(Partition partition, String path);

    StorageUsage usage();

    /**
     * Deletes every file in the temporary partition.
     *
     * @return the number of files deleted
     */
    int cleanupTemporary();

    /**
     * Deletes cache files last modified longer ago than maxAge.
     *
     * @return the number of files deleted
     */
    int cleanupCache(Duration maxAge);

    default String formatSize(final long bytes) {
        return SizeFormatter.format(bytes);
    }
}
