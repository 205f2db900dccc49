package com.affiliation.linkage.extract;

/**
 * What to do when a requested path ends on a JSON object.
 */
public enum ObjectLeafMode {
    /** Emit nothing for object leaves. */
    SKIP,
    /** Emit the object as compact JSON text. */
    SERIALIZE
}
