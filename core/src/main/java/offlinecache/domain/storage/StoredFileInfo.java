package offlinecache.domain.storage;

/**
 * A file as reported by {@link StorageBackend#list}.
 */
public record StoredFileInfo(String name, long size, long lastModified, String type) {
}
