package de.mirkosertic.imagebatch.vault;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts link targets from note text.
 * <p>
 * Recognizes wiki links ({@code [[target]]}, {@code ![[target|alias]]}, with optional
 * {@code #heading} or {@code ^block} suffix) and Markdown links
 * ({@code [alt](target)}, {@code ![alt](<target> "title")}). Targets are returned as
 * written, without alias, title or fragment.
 */
public final class MarkdownLinkExtractor {

    private static final Pattern WIKI_LINK = Pattern.compile("!?\\[\\[([^\\]|#^]+)[^\\]]*]]");
    private static final Pattern MARKDOWN_LINK =
            Pattern.compile("!?\\[[^\\]]*]\\(\\s*(?:<([^>]+)>|([^)\\s]+))(?:\\s+\"[^\"]*\")?\\s*\\)");

    private MarkdownLinkExtractor() {
    }

    public static List<String> extract(final String content) {
        // position -> target, so both link styles come out in document order
        final Map<Integer, String> byPosition = new TreeMap<>();

        final Matcher wiki = WIKI_LINK.matcher(content);
        while (wiki.find()) {
            final String target = wiki.group(1).trim();
            if (!target.isEmpty()) {
                byPosition.put(wiki.start(), target);
            }
        }

        final Matcher markdown = MARKDOWN_LINK.matcher(content);
        while (markdown.find()) {
            final String raw = markdown.group(1) != null ? markdown.group(1) : markdown.group(2);
            final String target = stripFragment(raw.trim());
            if (!target.isEmpty()) {
                byPosition.put(markdown.start(), target);
            }
        }

        return new ArrayList<>(byPosition.values());
    }

    /**
     * Decode percent escapes of a Markdown link target. Invalid escapes leave the text as is.
     */
    public static String decode(final String linkText) {
        if (linkText.indexOf('%') < 0) {
            return linkText;
        }
        try {
            return URLDecoder.decode(linkText.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (final IllegalArgumentException e) {
            return linkText;
        }
    }

    private static String stripFragment(final String target) {
        final int hash = target.indexOf('#');
        return hash < 0 ? target : target.substring(0, hash);
    }
}
