package com.affiliation.linkage.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All requested field paths compiled into one prefix tree, so a record is walked once
 * no matter how many paths are requested.
 *
 * <p>The walk is a recursive descent over the Jackson tree. Arrays are enumerated
 * (producing {@code [i]} in the indexed path) unless the trie asks for specific indexes.
 * Leaves are reported to a {@link LeafVisitor} in document order.</p>
 */
public final class PathTrie {

    /**
     * Receives every concrete occurrence of a requested path.
     */
    @FunctionalInterface
    public interface LeafVisitor {
        void visit(String fieldName, String indexedPath, JsonNode value);
    }

    private static final class Node {
        final Map<String, Node> children = new LinkedHashMap<>();
        final Map<Integer, Node> indexes = new TreeMap<>();
        final List<String> fields = new ArrayList<>();
        Node wildcard;

        boolean appliesToElements() {
            return !fields.isEmpty() || !children.isEmpty() || wildcard != null;
        }
    }

    private final Node root = new Node();
    private final List<FieldPath> paths;

    private PathTrie(List<FieldPath> paths) {
        this.paths = List.copyOf(paths);
        for (FieldPath path : paths) {
            insert(path);
        }
    }

    public static PathTrie compile(List<String> fieldPaths) {
        if (fieldPaths == null || fieldPaths.isEmpty()) {
            throw new IllegalArgumentException("At least one field path is required");
        }
        List<FieldPath> parsed = new ArrayList<>();
        for (String path : fieldPaths) {
            FieldPath fieldPath = FieldPath.parse(path);
            if (!parsed.contains(fieldPath)) {
                parsed.add(fieldPath);
            }
        }
        return new PathTrie(parsed);
    }

    public List<FieldPath> paths() {
        return paths;
    }

    /**
     * Walks the given record and reports every leaf reached by a requested path.
     */
    public void walk(JsonNode record, LeafVisitor visitor) {
        walk(record, root, "", visitor);
    }

    private void insert(FieldPath path) {
        Node node = root;
        for (FieldPath.Segment segment : path.segments()) {
            node = switch (segment.kind()) {
                case KEY -> node.children.computeIfAbsent(segment.key(), k -> new Node());
                case INDEX -> node.indexes.computeIfAbsent(segment.index(), k -> new Node());
                case WILDCARD -> {
                    if (node.wildcard == null) {
                        node.wildcard = new Node();
                    }
                    yield node.wildcard;
                }
            };
        }
        node.fields.add(path.toString());
    }

    private void walk(JsonNode value, Node node, String path, LeafVisitor visitor) {
        if (value == null || value.isMissingNode()) {
            return;
        }
        if (value.isArray()) {
            for (Map.Entry<Integer, Node> entry : node.indexes.entrySet()) {
                int index = entry.getKey();
                if (index < value.size()) {
                    walk(value.get(index), entry.getValue(), path + "[" + index + "]", visitor);
                }
            }
            if (node.appliesToElements()) {
                for (int i = 0; i < value.size(); i++) {
                    walk(value.get(i), node, path + "[" + i + "]", visitor);
                }
            }
            return;
        }

        for (String field : node.fields) {
            visitor.visit(field, path, value);
        }

        if (value.isObject() && (!node.children.isEmpty() || node.wildcard != null)) {
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String childPath = path.isEmpty() ? entry.getKey() : path + "." + entry.getKey();
                Node child = node.children.get(entry.getKey());
                if (child != null) {
                    walk(entry.getValue(), child, childPath, visitor);
                }
                if (node.wildcard != null) {
                    walk(entry.getValue(), node.wildcard, childPath, visitor);
                }
            }
        }
    }
}
