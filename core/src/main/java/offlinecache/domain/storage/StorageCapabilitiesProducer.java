package offlinecache.domain.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import offlinecache.domain.injection.Preferred;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.logging.Logger;

/**
 * Produces the StorageCapabilities selected by the configuration.
 */
@ApplicationScoped
public class StorageCapabilitiesProducer {

    @Inject
    @ConfigProperty(name = "oc.storage.provider", defaultValue = "filesystem")
    private String storageProvider;

    @Inject
    private Logger logger;

    @Produces
    @Preferred
    @ApplicationScoped
    public StorageCapabilities produceStorageCapabilities(
            final FileSystemStorageCapabilities fileSystemStorageCapabilities,
            final InMemoryStorageCapabilities inMemoryStorageCapabilities) {
        if ("memory".equalsIgnoreCase(storageProvider)) {
            logger.info("Using in-memory storage");
            return inMemoryStorageCapabilities;
        }

        return fileSystemStorageCapabilities;
    }
}
