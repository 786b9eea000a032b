package de.mirkosertic.imagebatch.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unique image targets of a run, in first-seen order, each with the documents that
 * reference it. Every path appears exactly once no matter how many documents, or how
 * many times within one document, mention it.
 * <p>
 * Built by the {@link ReferenceScanner} and read-only afterwards.
 */
public final class ReferenceSet {

    private final Map<String, ImageTarget> targets;
    private final Map<String, List<ReferringDocument>> documents;

    private ReferenceSet(final Map<String, ImageTarget> targets, final Map<String, List<ReferringDocument>> documents) {
        this.targets = targets;
        this.documents = documents;
    }

    public static ReferenceSet empty() {
        return new ReferenceSet(Map.of(), Map.of());
    }

    public List<ImageTarget> targets() {
        return List.copyOf(targets.values());
    }

    public List<ReferringDocument> documentsFor(final String path) {
        return documents.getOrDefault(path, List.of());
    }

    public boolean contains(final String path) {
        return targets.containsKey(path);
    }

    public int size() {
        return targets.size();
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates references while scanning.
     */
    static final class Builder {

        private final Map<String, ImageTarget> targets = new LinkedHashMap<>();
        private final Map<String, Map<String, MutableReference>> references = new LinkedHashMap<>();

        /**
         * Register a target without any referring document.
         */
        void addTarget(final ImageTarget target) {
            targets.putIfAbsent(target.path(), target);
            references.putIfAbsent(target.path(), new LinkedHashMap<>());
        }

        /**
         * Register one mention of {@code target} by a document.
         */
        void addReference(final ImageTarget target, final String documentPath, final DocumentKind kind,
                          final String linkText) {
            addTarget(target);
            references.get(target.path())
                    .computeIfAbsent(documentPath, p -> new MutableReference(p, kind))
                    .mention(linkText);
        }

        boolean contains(final String path) {
            return targets.containsKey(path);
        }

        ReferenceSet build() {
            final Map<String, List<ReferringDocument>> documents = new LinkedHashMap<>();
            for (final Map.Entry<String, Map<String, MutableReference>> entry : references.entrySet()) {
                final List<ReferringDocument> docs = new ArrayList<>();
                for (final MutableReference reference : entry.getValue().values()) {
                    docs.add(reference.toDocument());
                }
                documents.put(entry.getKey(), Collections.unmodifiableList(docs));
            }
            return new ReferenceSet(Collections.unmodifiableMap(new LinkedHashMap<>(targets)),
                    Collections.unmodifiableMap(documents));
        }
    }

    private static final class MutableReference {
        private final String path;
        private final DocumentKind kind;
        private final Set<String> linkTexts = new LinkedHashSet<>();
        private int mentions;

        MutableReference(final String path, final DocumentKind kind) {
            this.path = path;
            this.kind = kind;
        }

        void mention(final String linkText) {
            mentions++;
            linkTexts.add(linkText);
        }

        ReferringDocument toDocument() {
            return new ReferringDocument(path, kind, mentions, linkTexts);
        }
    }
}
