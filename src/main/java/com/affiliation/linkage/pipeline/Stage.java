package com.affiliation.linkage.pipeline;

/**
 * The stages of the pipeline, in data-flow order.
 */
public enum Stage {
    EXTRACT("extract"),
    SORT("sort"),
    JOIN("join"),
    LOAD("load"),
    LINKAGE("linkage"),
    DISCOVERY("discovery");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
