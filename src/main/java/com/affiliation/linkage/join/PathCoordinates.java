package com.affiliation.linkage.join;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sequence coordinates recovered from an indexed path. The first array index is the
 * author sequence and the second is the affiliation sequence; any later indexes are ignored.
 *
 * @param indexes  the array indexes in path order
 * @param parsable false if the path contains a malformed index such as {@code [x]} or {@code [}
 */
public record PathCoordinates(List<Integer> indexes, boolean parsable) {

    private static final Pattern INDEX = Pattern.compile("\\[(\\d{1,9})]");

    public static PathCoordinates parse(String indexedPath) {
        if (indexedPath == null || indexedPath.isEmpty()) {
            return new PathCoordinates(List.of(), false);
        }
        List<Integer> indexes = new ArrayList<>();
        Matcher matcher = INDEX.matcher(indexedPath);
        int brackets = 0;
        for (int i = 0; i < indexedPath.length(); i++) {
            if (indexedPath.charAt(i) == '[') {
                brackets++;
            }
        }
        while (matcher.find()) {
            indexes.add(Integer.parseInt(matcher.group(1)));
        }
        return new PathCoordinates(List.copyOf(indexes), indexes.size() == brackets);
    }

    /**
     * Returns the author sequence, or null if unavailable.
     */
    public Integer authorSequence() {
        return parsable && !indexes.isEmpty() ? indexes.get(0) : null;
    }

    /**
     * Returns the affiliation sequence, or null if unavailable.
     */
    public Integer affiliationSequence() {
        return parsable && indexes.size() > 1 ? indexes.get(1) : null;
    }
}
