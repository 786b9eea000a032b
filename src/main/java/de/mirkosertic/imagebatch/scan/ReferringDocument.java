package de.mirkosertic.imagebatch.scan;

import java.util.Set;

/**
 * A document that mentions an image.
 */
public record ReferringDocument(
        /** Vault path of the note or canvas. */
        String path,
        DocumentKind kind,
        /** How often the document mentions the image. Informational only. */
        int mentions,
        /** The link texts as written in the document, e.g. {@code a.png} for {@code images/a.png}. */
        Set<String> linkTexts
) {
    public ReferringDocument {
        linkTexts = Set.copyOf(linkTexts);
    }
}
