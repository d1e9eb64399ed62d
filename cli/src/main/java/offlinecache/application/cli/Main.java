package offlinecache.application.cli;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import offlinecache.Marker;
import offlinecache.domain.exceptionhandling.ExceptionHandler;
import offlinecache.domain.management.StorageManagement;
import offlinecache.domain.management.StorageStats;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.storage.StoredFileInfo;
import offlinecache.domain.sync.SyncStatus;
import offlinecache.domain.sync.SyncTask;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.util.Arrays;
import java.util.List;

/**
 * Runs one storage management command against the configured storage area.
 */
public class Main {
    private static final String CONFIRM_FLAG = "--confirm";
    private static final String VERBOSE_FLAG = "--verbose";

    @Inject
    private StorageBackend storageBackend;

    @Inject
    private StorageManagement storageManagement;

    @Inject
    private ExceptionHandler exceptionHandler;

    public static void main(final String[] args) {
        LogConfig.init(ArrayUtils.contains(args, VERBOSE_FLAG));

        final Weld weld = new Weld();
        final int exitCode;
        // The marker class lets Weld find the core beans when everything is packaged in one jar
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            exitCode = weldContainer.select(Main.class).get().entry(args);
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int entry(final String[] args) {
        final List<String> arguments = Arrays.stream(args)
                .filter(arg -> !VERBOSE_FLAG.equals(arg))
                .toList();

        if (arguments.isEmpty()) {
            printUsage();
            return 1;
        }

        return Try.run(storageBackend::initialize)
                .map(ignored -> run(arguments.get(0), arguments.subList(1, arguments.size())))
                .onFailure(e -> System.err.println("Failed to run " + arguments.get(0) + ": " + exceptionHandler.getExceptionMessage(e)))
                .getOrElse(1);
    }

    private int run(final String command, final List<String> options) {
        switch (command) {
            case "stats" -> printStats(storageManagement.getStorageStats());
            case "sync-status" -> printSyncStatus(storageManagement.getSyncStatus());
            case "status" -> System.out.println(storageManagement.getStatus().label());
            case "clear-query-cache" -> System.out.println("Removed " + storageManagement.clearQueryCache() + " cached query results");
            case "clear-expired-cache" -> System.out.println("Removed " + storageManagement.clearExpiredCache() + " expired entries");
            case "clear-offline-data" -> System.out.println("Removed " + storageManagement.clearOfflineData(options.contains(CONFIRM_FLAG)) + " entries");
            case "sync-now" -> printTask(storageManagement.syncNow());
            case "refresh-data" -> printTask(storageManagement.refreshData());
            case "clear-completed-tasks" -> System.out.println("Removed " + storageManagement.clearCompletedTasks() + " finished tasks");
            case "list" -> {
                return list(options);
            }
            default -> {
                System.err.println("Unknown command " + command);
                printUsage();
                return 1;
            }
        }

        return 0;
    }

    private int list(final List<String> options) {
        if (options.isEmpty()) {
            System.err.println("list needs a partition: datasets, cache or temporary");
            return 1;
        }

        return Partition.fromDirectoryName(options.get(0))
                .map(partition -> {
                    storageBackend.list(partition).forEach(this::printFile);
                    return 0;
                })
                .orElseGet(() -> {
                    System.err.println("Unknown partition " + options.get(0));
                    return 1;
                });
    }

    private void printStats(final StorageStats stats) {
        System.out.println("Total: " + storageManagement.formatBytes(stats.totalBytes()));
        stats.perDirectoryBytes().forEach((partition, bytes) ->
                System.out.println("  " + StringUtils.rightPad(partition.directoryName(), 10) + storageManagement.formatBytes(bytes)));
        System.out.println("Datasets: " + stats.datasetCount());
        System.out.println("Cache entries: " + stats.cacheEntryCount());
    }

    private void printSyncStatus(final SyncStatus status) {
        System.out.println("Pending: " + status.pending());
        System.out.println("Running: " + status.running());
        System.out.println("Completed: " + status.completed());
        System.out.println("Failed: " + status.failed());
    }

    private void printTask(final SyncTask task) {
        System.out.println("Queued " + task.kind().label() + " task " + task.id());
    }

    private void printFile(final StoredFileInfo file) {
        System.out.println(StringUtils.rightPad(file.name(), 40) + " "
                + StringUtils.leftPad(storageManagement.formatBytes(file.size()), 10) + " "
                + file.type());
    }

    private void printUsage() {
        System.err.println("""
                Usage: offlinecache <command> [--verbose]
                Commands:
                  stats
                  sync-status
                  status
                  clear-query-cache
                  clear-expired-cache
                  clear-offline-data --confirm
                  sync-now
                  refresh-data
                  clear-completed-tasks
                  list <datasets|cache|temporary>""");
    }
}
