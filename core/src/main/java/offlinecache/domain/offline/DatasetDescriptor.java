package offlinecache.domain.offline;

/**
 * A dataset the application knows how to download.
 *
 * @param autoUpdate true if a refresh of all datasets includes this one
 */
public record DatasetDescriptor(String name, String url, String format, boolean autoUpdate) {
    /**
     * The key the payload is stored under in the datasets partition.
     */
    public String storageKey() {
        return name + "." + format;
    }
}
