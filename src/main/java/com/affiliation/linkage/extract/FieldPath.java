package com.affiliation.linkage.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed field path such as {@code authorships.author.display_name},
 * {@code authorships[0].institutions[1].ror} or {@code locations.*.source}.
 *
 * <p>Syntax: segments separated by {@code .}; a segment is an object key or {@code *}
 * (any key), optionally followed by one or more {@code [n]} array indexes. A key segment
 * that meets an array is applied to every element.</p>
 */
public final class FieldPath {

    /**
     * One step of a path.
     *
     * @param kind  the step kind
     * @param key   the object key for {@link Kind#KEY}, otherwise null
     * @param index the array index for {@link Kind#INDEX}, otherwise -1
     */
    public record Segment(Kind kind, String key, int index) {

        public enum Kind { KEY, WILDCARD, INDEX }

        static Segment key(String key) {
            return new Segment(Kind.KEY, key, -1);
        }

        static Segment wildcard() {
            return new Segment(Kind.WILDCARD, null, -1);
        }

        static Segment index(int index) {
            return new Segment(Kind.INDEX, null, index);
        }
    }

    private final String text;
    private final List<Segment> segments;

    private FieldPath(String text, List<Segment> segments) {
        this.text = text;
        this.segments = List.copyOf(segments);
    }

    /**
     * Parses a path.
     *
     * @throws IllegalArgumentException if the path is empty or malformed
     */
    public static FieldPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Field path must not be blank");
        }
        String trimmed = path.trim();
        List<Segment> segments = new ArrayList<>();
        for (String part : trimmed.split("\\.", -1)) {
            int bracket = part.indexOf('[');
            String name = bracket < 0 ? part : part.substring(0, bracket);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty segment in field path '" + path + "'");
            }
            segments.add(name.equals("*") ? Segment.wildcard() : Segment.key(name));
            int pos = bracket;
            while (pos >= 0 && pos < part.length()) {
                int close = part.indexOf(']', pos);
                if (part.charAt(pos) != '[' || close < 0) {
                    throw new IllegalArgumentException("Malformed index in field path '" + path + "'");
                }
                String digits = part.substring(pos + 1, close);
                try {
                    int index = Integer.parseInt(digits);
                    if (index < 0) {
                        throw new IllegalArgumentException("Negative index in field path '" + path + "'");
                    }
                    segments.add(Segment.index(index));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Non-numeric index '" + digits + "' in field path '" + path + "'", e);
                }
                pos = close + 1;
            }
        }
        return new FieldPath(trimmed, segments);
    }

    public List<Segment> segments() {
        return segments;
    }

    /**
     * Returns the first non-container value this path reaches in the given tree, as text,
     * or null if the path resolves to nothing.
     */
    public String firstScalar(JsonNode root) {
        return firstScalar(root, 0);
    }

    private String firstScalar(JsonNode node, int position) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (position == segments.size()) {
            if (node.isValueNode()) {
                return node.asText();
            }
            if (node.isArray()) {
                for (JsonNode element : node) {
                    String value = firstScalar(element, position);
                    if (value != null) {
                        return value;
                    }
                }
            }
            return null;
        }
        Segment segment = segments.get(position);
        if (segment.kind() == Segment.Kind.INDEX) {
            return node.isArray() ? firstScalar(node.get(segment.index()), position + 1) : null;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = firstScalar(element, position);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        if (segment.kind() == Segment.Kind.KEY) {
            return firstScalar(node.get(segment.key()), position + 1);
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            String value = firstScalar(fields.next().getValue(), position + 1);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((FieldPath) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
