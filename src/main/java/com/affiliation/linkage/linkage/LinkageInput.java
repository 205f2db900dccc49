package com.affiliation.linkage.linkage;

import java.util.Objects;

/**
 * One external (document, author) reference to link.
 *
 * @param documentRef external document reference, possibly empty
 * @param authorRef   author name as written in the external file
 * @param lineNumber  record number in the input file, 0 when not read from a file
 */
public record LinkageInput(String documentRef, String authorRef, long lineNumber) {

    public LinkageInput {
        documentRef = Objects.requireNonNullElse(documentRef, "").trim();
        authorRef = Objects.requireNonNullElse(authorRef, "").trim();
    }

    public LinkageInput(String documentRef, String authorRef) {
        this(documentRef, authorRef, 0);
    }
}
