package com.affiliation.linkage.linkage;

import com.affiliation.linkage.extract.GroupingKeyMode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * How external document references are turned into stored document ids.
 */
public enum DocumentRefMode {
    /** The reference is looked up as written (trimmed). */
    AS_IS,
    /** The reference is a DOI, possibly as a resolver URL; it is cleaned and lowercased first. */
    DOI;

    /**
     * Returns the document ids to try, in order.
     */
    public List<String> lookupForms(String reference) {
        String trimmed = reference == null ? "" : reference.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (this == AS_IS) {
            return List.of(trimmed);
        }
        String doi = GroupingKeyMode.stripDoiUrl(trimmed.replaceAll("^[<\"']+|[>\"']+$", ""));
        int cut = indexOfAny(doi, '?', '#');
        if (cut >= 0) {
            doi = doi.substring(0, cut);
        }
        doi = doi.trim().replaceAll("[.,;:]+$", "");
        Set<String> forms = new LinkedHashSet<>();
        if (!doi.isEmpty()) {
            forms.add(doi);
            forms.add("https://doi.org/" + doi);
        }
        forms.add(trimmed);
        return List.copyOf(forms);
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) {
            return j;
        }
        return j < 0 ? i : Math.min(i, j);
    }
}
