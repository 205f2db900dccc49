package com.affiliation.linkage.discovery;

/**
 * A discovery input that led to nothing.
 *
 * @param input  the document id, affiliation text or affiliation key
 * @param kind   what the input was
 * @param reason why it matched nothing
 */
public record UnmatchedInput(String input, SeedSource kind, String reason) {}
