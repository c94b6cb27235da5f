package com.autoflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Dot-path lookup into JSON trees, e.g. {@code "lead.company.size"} or {@code "items.0.id"}.
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    /**
     * Resolve a path. Returns {@link MissingNode} when any segment is absent.
     */
    public static JsonNode resolve(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return MissingNode.getInstance();
        }
        if (root.has(path)) {
            return root.get(path);
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current.isObject()) {
                current = current.path(segment);
            } else if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                return MissingNode.getInstance();
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
