package offlinecache.domain.storage;

import java.util.List;
import java.util.Optional;

/**
 * A directory in the sandboxed file area. Names are single path segments; implementations
 * take care of any encoding the host needs.
 */
public interface StorageDirectory extends StorageHandle {
    /**
     * @return the child directory, or empty if it does not exist
     */
    Optional<StorageDirectory> directory(String name);

    /**
     * Returns the child directory, creating it if needed.
     */
    StorageDirectory createDirectory(String name);

    /**
     * @return the child file, or empty if it does not exist
     */
    Optional<StorageFile> file(String name);

    /**
     * Opens a scoped writer for the named file. Nothing is visible to readers until the writer is closed.
     */
    StorageWritable openWritable(String name);

    /**
     * Removes the named file. Directories are never removed through this call.
     *
     * @return false if there was no such file
     */
    boolean removeFile(String name);

    List<StorageHandle> entries();

    @Override
    default HandleKind kind() {
        return HandleKind.DIRECTORY;
    }
}
