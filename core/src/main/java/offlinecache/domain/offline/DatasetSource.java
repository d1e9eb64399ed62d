package offlinecache.domain.offline;

/**
 * Fetches dataset content from the network. Provided by the host application.
 */
public interface DatasetSource {
    DatasetDownload fetch(DatasetDescriptor dataset);
}
