package offlinecache.domain.query;

import java.util.List;
import java.util.Map;

/**
 * The rows returned by the query engine.
 */
public record QueryResult(List<Map<String, Object>> rows, List<String> columns, int rowCount, long executionTimeMs) {
}
