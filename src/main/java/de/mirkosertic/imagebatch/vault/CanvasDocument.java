package de.mirkosertic.imagebatch.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the file references of a canvas document.
 * <p>
 * A canvas is a JSON object with a {@code nodes} array. Nodes of {@code "type": "file"}
 * carry a vault path in their {@code file} property; group nodes may nest further
 * nodes in a {@code children} array.
 */
public final class CanvasDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanvasDocument() {
    }

    /**
     * @return the {@code file} values of all file nodes in document order, duplicates included
     * @throws JsonProcessingException if the content is not valid JSON
     */
    public static List<String> fileReferences(final String json) throws JsonProcessingException {
        final List<String> references = new ArrayList<>();
        final JsonNode root = MAPPER.readTree(json);
        if (root != null) {
            collect(root.get("nodes"), references);
        }
        return references;
    }

    /**
     * JSON string escaping of a path, without the surrounding quotes. Used to find a
     * path inside serialized canvas text.
     */
    public static String escape(final String path) {
        try {
            final String quoted = MAPPER.writeValueAsString(path);
            return quoted.substring(1, quoted.length() - 1);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize path " + path, e);
        }
    }

    private static void collect(final JsonNode nodes, final List<String> references) {
        if (nodes == null || !nodes.isArray()) {
            return;
        }
        for (final JsonNode node : nodes) {
            final JsonNode file = node.get("file");
            if ("file".equals(node.path("type").asText()) && file != null && file.isTextual()
                    && !file.asText().isEmpty()) {
                references.add(file.asText());
            }
            collect(node.get("children"), references);
        }
    }
}
