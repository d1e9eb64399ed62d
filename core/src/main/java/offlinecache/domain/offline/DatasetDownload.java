package offlinecache.domain.offline;

import org.jspecify.annotations.Nullable;

public record DatasetDownload(byte[] data, @Nullable String etag) {
}
