package offlinecache.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;
import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Produces JUL loggers named after the class they are injected into.
 * When oc.log.file is set, every produced logger also writes to that file.
 */
@ApplicationScoped
public class Loggers {

    @Inject
    @ConfigProperty(name = "oc.log.file")
    private Optional<String> logFile;

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    private void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", "%4$s: %5$s %n");
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = logFile
                .flatMap(file -> Try.of(() -> new FileHandler(file, true))
                        .onSuccess(handler -> handler.setFormatter(formatter))
                        .onFailure(ex -> Logger.getLogger(Loggers.class.getName())
                                .warning("Failed to open log file " + file + ": " + ex.getMessage()))
                        .toJavaOptional())
                .orElse(null);
    }

    @PreDestroy
    private void destroy() {
        if (fileHandler != null) {
            fileHandler.close();
        }
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        if (fileHandler != null && !Arrays.asList(logger.getHandlers()).contains(fileHandler)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }
}
