package offlinecache.domain.query;

/**
 * The analytical query engine. Provided by the host application.
 */
public interface QueryExecutor {
    QueryResult executeQuery(String sql);
}
