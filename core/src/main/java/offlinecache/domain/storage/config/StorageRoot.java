package offlinecache.domain.storage.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

@ApplicationScoped
public class StorageRoot {
    private static final String DEFAULT_ROOT = "offlinecache";

    @Inject
    @ConfigProperty(name = "oc.storage.root")
    private Optional<String> root;

    public Path getRoot() {
        return Paths.get(root.filter(value -> !value.isBlank()).orElse(DEFAULT_ROOT));
    }
}
