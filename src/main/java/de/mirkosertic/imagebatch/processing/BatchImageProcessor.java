package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.config.ApplicationConfig;
import de.mirkosertic.imagebatch.progress.ProgressReporter;
import de.mirkosertic.imagebatch.scan.ImageTarget;
import de.mirkosertic.imagebatch.scan.ReferenceScanner;
import de.mirkosertic.imagebatch.scan.ReferenceSet;
import de.mirkosertic.imagebatch.scan.ReferringDocument;
import de.mirkosertic.imagebatch.scan.ScanScope;
import de.mirkosertic.imagebatch.vault.VaultPaths;
import de.mirkosertic.imagebatch.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Converts, compresses and resizes the images of a note, a folder or the whole vault.
 * <p>
 * Targets are processed strictly one after another in {@link ReferenceSet} order:
 * read, transform, rename if the extension changes, write, and finally point every
 * referring document at the new name. A failure affects only the image at hand; it is
 * logged, counted as {@link ProcessingOutcome#SKIPPED_BY_ERROR} and the run continues.
 * If writing a renamed file fails, the rename is rolled back.
 * <p>
 * Only one run can be active at a time.
 */
public class BatchImageProcessor {

    private static final Logger logger = LoggerFactory.getLogger(BatchImageProcessor.class);

    private final ApplicationConfig config;
    private final VaultStore store;
    private final ReferenceScanner scanner;
    private final EligibilityFilter eligibilityFilter;
    private final ImageProcessor imageProcessor;
    private final ConflictResolver conflictResolver;
    private final PathReferenceRewriter referenceRewriter;
    private final ProgressReporter progressReporter;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchImageProcessor(
            final ApplicationConfig config,
            final VaultStore store,
            final ReferenceScanner scanner,
            final EligibilityFilter eligibilityFilter,
            final ImageProcessor imageProcessor,
            final ConflictResolver conflictResolver,
            final PathReferenceRewriter referenceRewriter,
            final ProgressReporter progressReporter) {
        this.config = config;
        this.store = store;
        this.scanner = scanner;
        this.eligibilityFilter = eligibilityFilter;
        this.imageProcessor = imageProcessor;
        this.conflictResolver = conflictResolver;
        this.referenceRewriter = referenceRewriter;
        this.progressReporter = progressReporter;
    }

    /**
     * Process the images referenced by one note or canvas.
     */
    public RunSummary processImagesInNote(final String documentPath) {
        return run(ScanScope.document(documentPath), config.getNoteSettings());
    }

    /**
     * Process the image files located in a folder. Links are not rewritten.
     */
    public RunSummary processImagesInFolder(final String folderPath, final boolean recursive) {
        return run(ScanScope.folder(folderPath, recursive), config.getNoteSettings());
    }

    /**
     * Process the images referenced by the notes and canvases of a folder.
     */
    public RunSummary processLinkedImagesInFolder(final String folderPath, final boolean recursive) {
        return run(ScanScope.linkedFolder(folderPath, recursive), config.getNoteSettings());
    }

    /**
     * Process the images referenced anywhere in the vault.
     */
    public RunSummary processAllVaultImages() {
        return run(ScanScope.vault(), config.getVaultSettings());
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunSummary run(final ScanScope scope, final ProcessingSettings settings) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Another image batch run is already active");
        }
        try {
            return runExclusive(scope, settings);
        } finally {
            running.set(false);
        }
    }

    private RunSummary runExclusive(final ScanScope scope, final ProcessingSettings settings) {
        final long startTime = System.currentTimeMillis();

        if (eligibilityFilter.isNoOp(settings)) {
            progressReporter.nothingToDo("No processing needed: original format selected with no compression or resizing.");
            return RunSummary.nothingToDo(scope, 0, System.currentTimeMillis() - startTime);
        }

        final ReferenceSet references = scanner.scan(scope);
        final List<ImageTarget> targets = references.targets();

        if (targets.isEmpty()) {
            progressReporter.nothingToDo(noImagesMessage(scope));
            return RunSummary.nothingToDo(scope, 0, System.currentTimeMillis() - startTime);
        }
        if (eligibilityFilter.allSkippable(targets, settings)) {
            progressReporter.nothingToDo(allSkippableMessage(settings));
            return RunSummary.nothingToDo(scope, targets.size(), System.currentTimeMillis() - startTime);
        }
        if (targets.stream().noneMatch(target -> eligibilityFilter.shouldProcess(target, settings))) {
            progressReporter.nothingToDo("No images found that need processing.");
            return RunSummary.nothingToDo(scope, targets.size(), System.currentTimeMillis() - startTime);
        }

        logger.info("Processing {} images of {} scope '{}'", targets.size(), scope.kind(), scope.path());
        progressReporter.start(targets.size());

        final Map<ProcessingOutcome, Integer> outcomes = new EnumMap<>(ProcessingOutcome.class);
        final List<RunSummary.Rename> renames = new ArrayList<>();
        for (final ImageTarget target : targets) {
            final ProcessingOutcome outcome = processTarget(target, references.documentsFor(target.path()),
                    settings, renames);
            outcomes.merge(outcome, 1, Integer::sum);
            logger.debug("{} -> {}", target.path(), outcome);
            progressReporter.targetCompleted();
        }

        final int processed = outcomes.getOrDefault(ProcessingOutcome.PROCESSED_AND_RENAMED, 0)
                + outcomes.getOrDefault(ProcessingOutcome.PROCESSED_NO_RENAME, 0);
        final long elapsedMs = progressReporter.complete(processed);
        final RunSummary summary = new RunSummary(scope, targets.size(), outcomes, renames, elapsedMs, false);
        logger.info("Run finished: {}", summary.outcomes());
        return summary;
    }

    private ProcessingOutcome processTarget(final ImageTarget target, final List<ReferringDocument> documents,
                                            final ProcessingSettings settings, final List<RunSummary.Rename> renames) {
        if (!eligibilityFilter.shouldProcess(target, settings)) {
            return ProcessingOutcome.SKIPPED_BY_FILTER;
        }

        final String oldPath = target.path();

        final byte[] original;
        try {
            final long maxImageBytes = config.getMaxImageBytes();
            if (maxImageBytes >= 0 && target.sizeInBytes() > maxImageBytes) {
                logger.warn("Skipping {}: {} bytes exceeds limit of {} bytes", oldPath, target.sizeInBytes(),
                        maxImageBytes);
                return ProcessingOutcome.SKIPPED_BY_ERROR;
            }
            original = store.readBinary(oldPath);
        } catch (final IOException | RuntimeException e) {
            return failed(target, "Failed to read image " + oldPath, e);
        }

        final byte[] transformed;
        try {
            transformed = imageProcessor.transform(original, target.extension(), settings);
        } catch (final ImageProcessingException | RuntimeException e) {
            return failed(target, "Failed to process image " + oldPath, e);
        }

        final String destinationName = destinationName(target, settings.outputFormat());
        String currentPath = oldPath;
        final boolean renamed = !destinationName.equals(target.name());
        if (renamed) {
            try {
                final String finalName = conflictResolver.resolveConflict(target.parent(), destinationName,
                        config.getConflictMode());
                final String newPath = VaultPaths.join(target.parent(), finalName);
                store.rename(oldPath, newPath);
                if (store.resolve(newPath) == null) {
                    logger.error("Renamed {} to {}, but the renamed file cannot be resolved", oldPath, newPath);
                    progressReporter.targetFailed("Error processing image \"" + target.name() + "\"");
                    return ProcessingOutcome.SKIPPED_BY_ERROR;
                }
                currentPath = newPath;
            } catch (final IOException | RuntimeException e) {
                return failed(target, "Failed to rename image " + oldPath, e);
            }
        }

        try {
            store.writeBinary(currentPath, transformed);
        } catch (final IOException | RuntimeException e) {
            if (renamed) {
                rollbackRename(currentPath, oldPath);
            }
            return failed(target, "Failed to write image " + currentPath, e);
        }

        logger.debug("Wrote {} ({} -> {} bytes)", currentPath, original.length, transformed.length);

        if (!renamed) {
            return ProcessingOutcome.PROCESSED_NO_RENAME;
        }

        renames.add(new RunSummary.Rename(oldPath, currentPath));
        for (final ReferringDocument document : documents) {
            updateLinks(document, oldPath, currentPath);
        }
        return ProcessingOutcome.PROCESSED_AND_RENAMED;
    }

    /**
     * File name after conversion. The name stays the same if the format is kept or the
     * file already carries an extension of the output format.
     */
    static String destinationName(final ImageTarget target, final OutputFormat outputFormat) {
        if (outputFormat == OutputFormat.ORIGINAL || outputFormat.matchesExtension(target.extension())) {
            return target.name();
        }
        return target.basename() + "." + outputFormat.extension();
    }

    private void updateLinks(final ReferringDocument document, final String oldPath, final String newPath) {
        try {
            final String content = store.read(document.path());
            final String updated = referenceRewriter.rewrite(content, document.kind(), oldPath, newPath,
                    document.linkTexts());
            if (!updated.equals(content)) {
                store.write(document.path(), updated);
                logger.debug("Updated links in {}: {} -> {}", document.path(), oldPath, newPath);
            }
        } catch (final IOException | RuntimeException e) {
            // the image itself was converted, so the target still counts as processed
            logger.error("Failed to update links in {} for {}", document.path(), newPath, e);
            progressReporter.targetFailed("Failed to update links in \"" + document.path() + "\" for \""
                    + VaultPaths.fileName(newPath) + "\"");
        }
    }

    private void rollbackRename(final String currentPath, final String oldPath) {
        try {
            store.rename(currentPath, oldPath);
            logger.info("Rolled back rename {} -> {}", currentPath, oldPath);
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to roll back rename {} -> {}", currentPath, oldPath, e);
        }
    }

    private ProcessingOutcome failed(final ImageTarget target, final String message, final Exception e) {
        logger.error(message, e);
        progressReporter.targetFailed("Error processing image \"" + target.name() + "\": " + e.getMessage());
        return ProcessingOutcome.SKIPPED_BY_ERROR;
    }

    private static String noImagesMessage(final ScanScope scope) {
        return switch (scope.kind()) {
            case DOCUMENT -> "No images found in the note.";
            case FOLDER, LINKED_FOLDER -> "No images found in the folder.";
            case VAULT -> "No images found in the vault.";
        };
    }

    private static String allSkippableMessage(final ProcessingSettings settings) {
        if (settings.isKeepOriginalFormat()) {
            return "No processing needed: all images are either in skip list or kept in original format "
                    + "with no compression or resizing.";
        }
        return "No processing needed: all images are either in skip list or already in "
                + settings.outputFormat().extension().toUpperCase(Locale.ROOT)
                + " format with no compression or resizing.";
    }
}
