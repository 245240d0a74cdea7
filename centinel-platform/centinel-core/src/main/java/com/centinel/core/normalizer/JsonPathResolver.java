package com.centinel.core.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Resolves dot-delimited paths ({@code estadisticas.distribucion_votos.validos},
 * {@code resultados.0.votos}) against a JSON tree. A numeric segment indexes an
 * array; any other segment selects an object field. JSON {@code null} counts as
 * absent.
 */
public final class JsonPathResolver {

    private JsonPathResolver() {
    }

    public static Optional<JsonNode> resolve(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        return descend(root, path.split("\\."), 0);
    }

    /**
     * Tries each path left to right and returns the first one that resolves.
     */
    public static Optional<Match> firstPresent(JsonNode root, List<String> paths) {
        if (paths == null) {
            return Optional.empty();
        }
        for (String path : paths) {
            Optional<JsonNode> value = resolve(root, path);
            if (value.isPresent()) {
                return Optional.of(new Match(path, value.get()));
            }
        }
        return Optional.empty();
    }

    public static boolean isPresent(JsonNode root, String path) {
        return resolve(root, path).isPresent();
    }

    private static Optional<JsonNode> descend(JsonNode current, String[] segments, int index) {
        if (current == null || current.isNull() || current.isMissingNode()) {
            return Optional.empty();
        }
        if (index == segments.length) {
            return Optional.of(current);
        }
        String segment = segments[index];
        if (segment.isEmpty()) {
            return Optional.empty();
        }
        JsonNode next;
        if (current.isArray()) {
            int position = parseIndex(segment);
            if (position < 0 || position >= current.size()) {
                return Optional.empty();
            }
            next = current.get(position);
        } else if (current.isObject()) {
            next = current.get(segment);
        } else {
            return Optional.empty();
        }
        return descend(next, segments, index + 1);
    }

    private static int parseIndex(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    // ==================== Inner Types ====================

    /**
     * A resolved value together with the path that produced it.
     */
    public record Match(String path, JsonNode value) {
        public Match {
            Objects.requireNonNull(path, "Path cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }
}
