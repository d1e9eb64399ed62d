package offlinecache.domain.storage;

public interface StorageFile extends StorageHandle {
    long size();

    long lastModified();

    String contentType();

    /**
     * @throws offlinecache.domain.exceptions.StorageNotFound if the file was removed after the handle was obtained
     */
    byte[] readAllBytes();

    @Override
    default HandleKind kind() {
        return HandleKind.FILE;
    }
}
