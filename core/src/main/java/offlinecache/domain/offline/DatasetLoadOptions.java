package offlinecache.domain.offline;

/**
 * @param forceRefresh    skip the cached copy and download
 * @param fallbackToCache serve a cached copy, however old, if the download fails
 */
public record DatasetLoadOptions(boolean forceRefresh, boolean fallbackToCache) {
    public static DatasetLoadOptions defaults() {
        return new DatasetLoadOptions(false, true);
    }

    public static DatasetLoadOptions refresh() {
        return new DatasetLoadOptions(true, false);
    }
}
