package offlinecache.domain.offline;

/**
 * @param stale true if the data is older than the staleness threshold, or was served after a failed download
 */
public record DatasetLoadResult(byte[] data, boolean fromCache, boolean stale, DatasetDescriptor dataset) {
}
