package offlinecache.domain.storage;

/**
 * An entry in the sandboxed file area.
 */
public interface StorageHandle {
    String name();

    HandleKind kind();
}
