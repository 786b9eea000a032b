package de.mirkosertic.imagebatch.progress;

import de.mirkosertic.imagebatch.NotificationService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shows the progress of a batch run on a {@link StatusSurface} and announces its result.
 * <p>
 * Progress is updated from the thread that runs the batch. The finished indicator is
 * removed after a delay by a daemon timer thread, so the JVM can exit while an
 * indicator is still pending removal.
 */
public class ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    static final String NOTIFICATION_TITLE = "Image Batch";

    private final StatusSurface surface;
    private final NotificationService notificationService;
    private final long dismissDelayMs;

    private final ScheduledExecutorService dismissExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "status-dismiss");
                t.setDaemon(true);
                return t;
            });

    private volatile @Nullable StatusIndicator indicator;
    private volatile @Nullable RunProgress progress;

    public ProgressReporter(final StatusSurface surface, final NotificationService notificationService,
                            final long dismissDelayMs) {
        this.surface = surface;
        this.notificationService = notificationService;
        this.dismissDelayMs = dismissDelayMs;
    }

    /**
     * Begin tracking a run over {@code total} targets.
     */
    public void start(final int total) {
        indicator = surface.createIndicator();
        progress = new RunProgress(0, total, System.currentTimeMillis());
        logger.debug("Run started with {} targets", total);
    }

    /**
     * Record that one more target has been attempted, regardless of its outcome.
     */
    public void targetCompleted() {
        final RunProgress current = progress;
        final StatusIndicator statusIndicator = indicator;
        if (current == null || statusIndicator == null) {
            return;
        }
        final RunProgress next = new RunProgress(current.index() + 1, current.total(), current.startTime());
        progress = next;
        statusIndicator.setText(progressText(next.index(), next.total()));
    }

    /**
     * Show the final summary and schedule removal of the indicator.
     *
     * @param processedCount number of targets that were actually processed
     * @return elapsed time of the run in milliseconds
     */
    public long complete(final int processedCount) {
        final RunProgress current = progress;
        final StatusIndicator statusIndicator = indicator;
        if (current == null || statusIndicator == null) {
            return 0;
        }
        final long elapsedMs = System.currentTimeMillis() - current.startTime();
        final String summary = summaryText(processedCount, elapsedMs);
        statusIndicator.setText(summary);
        logger.info(summary);
        notificationService.notify(NOTIFICATION_TITLE, summary);

        dismissExecutor.schedule(() -> dismiss(statusIndicator), dismissDelayMs, TimeUnit.MILLISECONDS);
        return elapsedMs;
    }

    /**
     * Tell the user why a run ended without processing anything.
     */
    public void nothingToDo(final String reason) {
        logger.info(reason);
        notificationService.notify(NOTIFICATION_TITLE, reason);
    }

    /**
     * Report a failure concerning a single image. The run continues.
     */
    public void targetFailed(final String message) {
        notificationService.notify(NOTIFICATION_TITLE, message);
    }

    public @Nullable RunProgress getProgress() {
        return progress;
    }

    public void shutdown() {
        dismissExecutor.shutdown();
        try {
            if (!dismissExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                dismissExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            dismissExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static String progressText(final int index, final int total) {
        return "Processing image " + index + " of " + total;
    }

    static String summaryText(final int processedCount, final long elapsedMs) {
        return String.format(Locale.ROOT, "Finished processing %d images, total time: %.2f seconds",
                processedCount, elapsedMs / 1000.0);
    }

    private void dismiss(final StatusIndicator statusIndicator) {
        try {
            statusIndicator.remove();
            if (indicator == statusIndicator) {
                indicator = null;
                progress = null;
            }
        } catch (final RuntimeException e) {
            logger.error("Failed to remove status indicator", e);
        }
    }
}
