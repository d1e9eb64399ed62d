package offlinecache.domain.exceptions;

/**
 * Marker interface for external exceptions. These are failures of the host environment,
 * like a full disk or a revoked permission, that may succeed if the operation is retried.
 */
public interface ExternalException {
}
