package offlinecache.domain.storage;

import java.nio.charset.StandardCharsets;

/**
 * How the content of a stored file is returned by {@link StorageBackend#read}.
 */
@FunctionalInterface
public interface ReadMode<T> {
    ReadMode<byte[]> BYTES = StorageFile::readAllBytes;
    ReadMode<String> TEXT = file -> new String(file.readAllBytes(), StandardCharsets.UTF_8);
    ReadMode<StorageFile> HANDLE = file -> file;

    T read(StorageFile file);
}
