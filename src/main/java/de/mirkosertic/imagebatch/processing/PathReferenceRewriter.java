package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.scan.DocumentKind;
import de.mirkosertic.imagebatch.vault.CanvasDocument;
import de.mirkosertic.imagebatch.vault.VaultPaths;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces references to a renamed image inside the serialized text of a note or canvas.
 * <p>
 * A literal is only replaced where it forms a whole link target, i.e. it is delimited by
 * link syntax ({@code [[ ]]}, {@code ( )}, {@code < >}, quotes, alias and fragment markers)
 * or whitespace. This keeps {@code a.png} from matching inside {@code banana.png}.
 */
public class PathReferenceRewriter {

    private static final String BEFORE = "(?<![^\\[(<\"\\s])";
    private static final String AFTER = "(?![^\\]|#^)>\"\\s])";

    /**
     * @param content   current document text
     * @param kind      kind of the document; canvas text is JSON, so escaped forms are replaced as well
     * @param oldPath   vault path of the image before the rename
     * @param newPath   vault path after the rename
     * @param linkTexts link targets as the document wrote them
     * @return the rewritten content, identical to {@code content} if nothing matched
     */
    public String rewrite(final String content, final DocumentKind kind, final String oldPath, final String newPath,
                          final Collection<String> linkTexts) {
        final String newFileName = VaultPaths.fileName(newPath);

        final Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put(oldPath, newPath);
        for (final String linkText : linkTexts) {
            replacements.putIfAbsent(linkText, retarget(linkText, newFileName));
        }
        if (kind == DocumentKind.CANVAS) {
            for (final Map.Entry<String, String> entry : new ArrayList<>(replacements.entrySet())) {
                replacements.putIfAbsent(CanvasDocument.escape(entry.getKey()), CanvasDocument.escape(entry.getValue()));
            }
        }

        final List<Map.Entry<String, String>> ordered = new ArrayList<>(replacements.entrySet());
        ordered.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());

        String result = content;
        for (final Map.Entry<String, String> entry : ordered) {
            if (entry.getKey().isEmpty() || entry.getKey().equals(entry.getValue())) {
                continue;
            }
            final Pattern pattern = Pattern.compile(BEFORE + Pattern.quote(entry.getKey()) + AFTER);
            result = pattern.matcher(result).replaceAll(Matcher.quoteReplacement(entry.getValue()));
        }
        return result;
    }

    /**
     * Point a link text at a new file name while keeping its folder part and its
     * {@code %20} encoding, e.g. {@code ../img/my%20photo.png} becomes
     * {@code ../img/my%20photo.webp}.
     */
    static String retarget(final String linkText, final String newFileName) {
        final int slash = linkText.lastIndexOf('/');
        final String folderPart = linkText.substring(0, slash + 1);
        final String lastSegment = linkText.substring(slash + 1);

        final boolean encoded = lastSegment.contains("%") && !decode(lastSegment).equals(lastSegment);
        return folderPart + (encoded ? newFileName.replace(" ", "%20") : newFileName);
    }

    private static String decode(final String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (final IllegalArgumentException e) {
            return value;
        }
    }
}
