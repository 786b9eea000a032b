package de.mirkosertic.imagebatch.scan;

import de.mirkosertic.imagebatch.vault.CanvasDocument;
import de.mirkosertic.imagebatch.vault.SupportedImageFormats;
import de.mirkosertic.imagebatch.vault.VaultFile;
import de.mirkosertic.imagebatch.vault.VaultPaths;
import de.mirkosertic.imagebatch.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link ReferenceSet} for a {@link ScanScope}.
 * <p>
 * Documents are visited in the store's sorted order, notes before canvases, and
 * targets keep the order in which they were first seen. Two scans of an unchanged
 * vault therefore produce identical target sequences.
 * <p>
 * A document that cannot be read or parsed is logged and skipped; link targets
 * that are external URLs or do not resolve to an existing image are dropped.
 */
public class ReferenceScanner {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceScanner.class);

    private final VaultStore store;
    private final SupportedImageFormats supportedFormats;
    private final boolean includeUnreferencedImages;

    public ReferenceScanner(final VaultStore store, final SupportedImageFormats supportedFormats,
                            final boolean includeUnreferencedImages) {
        this.store = store;
        this.supportedFormats = supportedFormats;
        this.includeUnreferencedImages = includeUnreferencedImages;
    }

    /**
     * Scan the given scope.
     *
     * @throws IllegalArgumentException if the scope names a document that is not an existing
     *                                  note or canvas, or a folder that does not exist
     */
    public ReferenceSet scan(final ScanScope scope) {
        final ReferenceSet.Builder builder = ReferenceSet.builder();
        switch (scope.kind()) {
            case DOCUMENT -> scanSingleDocument(builder, scope.path());
            case FOLDER -> scanFolderFiles(builder, scope.path(), scope.recursive());
            case LINKED_FOLDER -> scanFolderDocuments(builder, scope.path(), scope.recursive());
            case VAULT -> scanVault(builder);
        }
        final ReferenceSet result = builder.build();
        logger.info("Scanned {} scope '{}': {} unique images", scope.kind(), scope.path(), result.size());
        return result;
    }

    static boolean isExternalUrl(final String linkText) {
        final String lower = linkText.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private void scanSingleDocument(final ReferenceSet.Builder builder, final String path) {
        final DocumentKind kind = DocumentKind.of(path);
        if (kind == null || store.resolve(path) == null) {
            throw new IllegalArgumentException("Not an existing note or canvas: " + path);
        }
        scanDocument(builder, path, kind);
    }

    private void scanFolderFiles(final ReferenceSet.Builder builder, final String folder, final boolean recursive) {
        requireFolder(folder);
        try {
            for (final VaultFile file : store.listFiles(folder, recursive)) {
                if (supportedFormats.isSupported(file.name())) {
                    builder.addTarget(new ImageTarget(file, store));
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to list folder '{}'", folder, e);
        }
    }

    private void scanFolderDocuments(final ReferenceSet.Builder builder, final String folder, final boolean recursive) {
        requireFolder(folder);
        for (final VaultFile document : listDocuments()) {
            if (VaultPaths.isInFolder(document.path(), folder, recursive)) {
                scanDocument(builder, document.path(), DocumentKind.of(document.path()));
            }
        }
    }

    private void scanVault(final ReferenceSet.Builder builder) {
        for (final VaultFile document : listDocuments()) {
            scanDocument(builder, document.path(), DocumentKind.of(document.path()));
        }

        if (includeUnreferencedImages) {
            try {
                int added = 0;
                for (final VaultFile file : store.listFiles("", true)) {
                    if (supportedFormats.isSupported(file.name()) && !builder.contains(file.path())) {
                        builder.addTarget(new ImageTarget(file, store));
                        added++;
                    }
                }
                logger.debug("Added {} unreferenced images", added);
            } catch (final IOException e) {
                logger.warn("Failed to list vault images", e);
            }
        }
    }

    /**
     * All notes followed by all canvases, each group in path order.
     */
    private List<VaultFile> listDocuments() {
        final List<VaultFile> documents = new ArrayList<>();
        try {
            documents.addAll(store.listNotes());
        } catch (final IOException e) {
            logger.warn("Failed to list notes", e);
        }
        try {
            documents.addAll(store.listCanvasFiles());
        } catch (final IOException e) {
            logger.warn("Failed to list canvas files", e);
        }
        return documents;
    }

    private void scanDocument(final ReferenceSet.Builder builder, final String documentPath, final DocumentKind kind) {
        final List<String> linkTexts;
        try {
            linkTexts = kind == DocumentKind.CANVAS
                    ? CanvasDocument.fileReferences(store.read(documentPath))
                    : store.linkTargets(documentPath);
        } catch (final IOException e) {
            // JsonProcessingException is an IOException as well
            logger.warn("Skipping unreadable document {}: {}", documentPath, e.getMessage());
            return;
        }

        for (final String linkText : linkTexts) {
            if (isExternalUrl(linkText)) {
                continue;
            }
            final VaultFile file = store.resolveLink(linkText, documentPath);
            if (file == null) {
                logger.debug("Unresolved link '{}' in {}", linkText, documentPath);
                continue;
            }
            if (!supportedFormats.isSupported(file.name())) {
                continue;
            }
            builder.addReference(new ImageTarget(file, store), documentPath, kind, linkText);
        }
    }

    private void requireFolder(final String folder) {
        if (!folder.isEmpty() && !store.isFolder(folder)) {
            throw new IllegalArgumentException("Not an existing folder: " + folder);
        }
    }
}
