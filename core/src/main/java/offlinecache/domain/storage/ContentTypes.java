package offlinecache.domain.storage;

import org.apache.commons.lang3.StringUtils;

import java.net.URLConnection;
import java.util.Map;

/**
 * Guesses a MIME type from a file name.
 */
public final class ContentTypes {
    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String, String> KNOWN = Map.of(
            "json", "application/json",
            "csv", "text/csv",
            "parquet", "application/vnd.apache.parquet",
            "arrow", "application/vnd.apache.arrow.file");

    private ContentTypes() {
    }

    public static String of(final String name) {
        final String extension = StringUtils.lowerCase(StringUtils.substringAfterLast(name, "."));
        if (KNOWN.containsKey(extension)) {
            return KNOWN.get(extension);
        }

        return StringUtils.defaultIfBlank(URLConnection.guessContentTypeFromName(name), DEFAULT);
    }
}
