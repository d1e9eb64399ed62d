package offlinecache.domain.query;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import offlinecache.domain.cache.CacheController;
import offlinecache.domain.cache.CacheResult;
import offlinecache.domain.cache.GetOptions;
import offlinecache.domain.cache.PutOptions;
import offlinecache.domain.exceptions.InternalFailure;
import offlinecache.domain.json.JsonDeserializer;
import offlinecache.domain.query.config.QueryResultTtl;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Serves query results from the cache partition, running the query only on a miss.
 * Results are stored as JSON under a key derived from the query fingerprint and tagged so they
 * can be cleared as a group.
 */
@ApplicationScoped
public class QueryResultCache {
    public static final String KIND_METADATA = "kind";
    public static final String QUERY_RESULT_KIND = "query-result";
    public static final String FINGERPRINT_METADATA = "fingerprint";

    @Inject
    private CacheController cacheController;

    @Inject
    private QueryFingerprint queryFingerprint;

    @Inject
    private QueryResultTtl queryResultTtl;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Instance<QueryExecutor> queryExecutor;

    @Inject
    private Logger logger;

    public CacheResult<QueryResult> execute(final String sql) {
        final String key = queryFingerprint.cacheKey(sql);

        final Optional<QueryResult> cached = cacheController.get(key, GetOptions.defaults(),
                bytes -> jsonDeserializer.deserialize(new String(bytes, StandardCharsets.UTF_8), QueryResult.class));

        if (cached.isPresent()) {
            return new CacheResult<>(cached.get(), true);
        }

        final QueryResult result = executor().executeQuery(sql);

        cacheController.put(
                key,
                jsonDeserializer.serialize(result).getBytes(StandardCharsets.UTF_8),
                PutOptions.defaults()
                        .withTtl(queryResultTtl.getQueryTtl())
                        .withMetadata(Map.of(
                                KIND_METADATA, QUERY_RESULT_KIND,
                                FINGERPRINT_METADATA, queryFingerprint.fingerprint(sql))));

        logger.info("Cached result of query " + queryFingerprint.fingerprint(sql) + " (" + result.rowCount() + " rows)");
        return new CacheResult<>(result, false);
    }

    public boolean invalidate(final String sql) {
        return cacheController.invalidate(queryFingerprint.cacheKey(sql));
    }

    /**
     * Removes every cached query result. Other cache entries are kept.
     */
    public int clear() {
        return cacheController.invalidateByMetadata(KIND_METADATA, QUERY_RESULT_KIND);
    }

    private QueryExecutor executor() {
        if (queryExecutor.isUnsatisfied()) {
            throw new InternalFailure("No query executor is available");
        }

        return queryExecutor.get();
    }
}
