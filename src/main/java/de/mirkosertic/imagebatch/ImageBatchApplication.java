package de.mirkosertic.imagebatch;

import de.mirkosertic.imagebatch.cli.BatchOperation;
import de.mirkosertic.imagebatch.cli.CommandFactory;
import de.mirkosertic.imagebatch.cli.ImageBatchCommand;
import de.mirkosertic.imagebatch.config.ApplicationConfig;
import de.mirkosertic.imagebatch.config.LoggingConfigurator;
import de.mirkosertic.imagebatch.processing.BatchImageProcessor;
import de.mirkosertic.imagebatch.processing.EligibilityFilter;
import de.mirkosertic.imagebatch.processing.ImageIoImageProcessor;
import de.mirkosertic.imagebatch.processing.PathReferenceRewriter;
import de.mirkosertic.imagebatch.processing.RunSummary;
import de.mirkosertic.imagebatch.processing.VaultConflictResolver;
import de.mirkosertic.imagebatch.progress.LoggingStatusSurface;
import de.mirkosertic.imagebatch.progress.ProgressReporter;
import de.mirkosertic.imagebatch.scan.ReferenceScanner;
import de.mirkosertic.imagebatch.vault.FilePatternMatcher;
import de.mirkosertic.imagebatch.vault.FileSystemVaultStore;
import de.mirkosertic.imagebatch.vault.SupportedImageFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point. Runs a single batch over a note, a folder or the whole vault
 * configured in {@link ApplicationConfig} and exits. Usage errors exit with status 2.
 */
public class ImageBatchApplication {

    private static final Logger logger = LoggerFactory.getLogger(ImageBatchApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String NOTIFICATION_TITLE = "Image Batch";

    private final ApplicationConfig config;
    private final NotificationService notificationService;
    private final ProgressReporter progressReporter;
    private final BatchImageProcessor batchProcessor;

    public ImageBatchApplication(final ApplicationConfig config) {
        this.config = config;

        final Path vaultRoot = Paths.get(config.getVaultPath());
        final FileSystemVaultStore store = new FileSystemVaultStore(vaultRoot,
                new FilePatternMatcher(config.getExcludePatterns()));

        this.notificationService = new NotificationService(config.isNotificationsEnabled());

        this.progressReporter = new ProgressReporter(new LoggingStatusSurface(), notificationService,
                config.getStatusDismissDelayMs());

        final ReferenceScanner scanner = new ReferenceScanner(store, new SupportedImageFormats(),
                config.isIncludeUnreferencedImages());

        this.batchProcessor = new BatchImageProcessor(
                config,
                store,
                scanner,
                new EligibilityFilter(),
                new ImageIoImageProcessor(),
                new VaultConflictResolver(store),
                new PathReferenceRewriter(),
                progressReporter
        );
    }

    /**
     * Verify that the configured vault exists.
     */
    public void init() {
        final Path vaultRoot = Paths.get(config.getVaultPath());
        if (!Files.isDirectory(vaultRoot)) {
            throw new IllegalStateException("Vault directory does not exist: " + vaultRoot);
        }
        logger.info("Using vault {}", vaultRoot.toAbsolutePath());
    }

    public RunSummary execute(final BatchOperation operation) {
        return operation.runOn(batchProcessor);
    }

    public void shutdown() {
        try {
            progressReporter.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down progress reporter", e);
        }
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new ImageBatchCommand(), new CommandFactory(ImageBatchApplication::launch))
                .execute(args);
        System.exit(exitCode);
    }

    /**
     * Runs a single batch operation. Any setup failure is logged, reported as desktop
     * notification and turned into {@link #EXIT_FAILURE}.
     */
    static int launch(final BatchOperation operation) {
        ImageBatchApplication app = null;
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            app = new ImageBatchApplication(config);
            app.init();
            final RunSummary summary = app.execute(operation);

            logger.info("Processed {} of {} images, {} renamed", summary.processedCount(), summary.total(),
                    summary.renames().size());
            return EXIT_OK;
        } catch (final Exception e) {
            logger.error("Image batch run failed", e);
            System.err.println("Image batch run failed: " + e.getMessage());
            final NotificationService notifier = app != null ? app.notificationService : new NotificationService(true);
            notifier.notify(NOTIFICATION_TITLE, "Error processing images: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            if (app != null) {
                app.shutdown();
            }
        }
    }
}
