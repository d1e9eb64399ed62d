package offlinecache.domain.zip;

/**
 * Compresses and decompresses payloads.
 */
public interface Zipper {
    byte[] compress(byte[] data);

    byte[] decompress(byte[] compressedData);
}
