package offlinecache.domain.query;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Derives cache keys from SQL text. Queries that differ only in whitespace or a trailing
 * semicolon share a key.
 */
@ApplicationScoped
public class QueryFingerprint {
    private static final String KEY_PREFIX = "query-";
    private static final String KEY_SUFFIX = ".json";

    public String normalize(final String sql) {
        checkArgument(StringUtils.isNotBlank(sql), "sql must not be blank");

        String normalized = StringUtils.normalizeSpace(sql);
        while (normalized.endsWith(";")) {
            normalized = StringUtils.removeEnd(normalized, ";").trim();
        }

        return normalized;
    }

    public String fingerprint(final String sql) {
        return DigestUtils.sha256Hex(normalize(sql));
    }

    public String cacheKey(final String sql) {
        return KEY_PREFIX + fingerprint(sql) + KEY_SUFFIX;
    }
}
