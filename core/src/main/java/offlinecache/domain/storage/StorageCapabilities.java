package offlinecache.domain.storage;

/**
 * The host's hierarchical storage. Implementations are selected by StorageCapabilitiesProducer.
 */
public interface StorageCapabilities {
    /**
     * Probes the host. Must not throw.
     */
    boolean isSupported();

    /**
     * @throws offlinecache.domain.exceptions.UnsupportedEnvironment if the host has no usable storage
     */
    StorageDirectory openRoot();
}
