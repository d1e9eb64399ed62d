package offlinecache.domain.storage;

/**
 * A pending write. {@link #close()} commits the content atomically, {@link #abort()} discards it.
 */
public interface StorageWritable extends AutoCloseable {
    void write(byte[] data);

    @Override
    void close();

    void abort();
}
