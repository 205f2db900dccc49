package com.affiliation.linkage.store;

import com.affiliation.linkage.core.model.RejectionReason;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of loading a triples file into an {@link IndexedStore}.
 *
 * @param rowsRead  data rows read from the input
 * @param accepted  rows stored
 * @param rejected  rows diverted to the error log
 * @param byReason  rejections per reason code
 * @param errorLog  path of the written error log
 */
public record LoadResult(long rowsRead, long accepted, long rejected,
                         Map<RejectionReason, Long> byReason, Path errorLog) {

    public LoadResult {
        byReason = byReason.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(byReason));
    }

    public long rejectedFor(RejectionReason reason) {
        return byReason.getOrDefault(reason, 0L);
    }

    /**
     * True when every row read was either stored or logged. Rejections alone never fail a load.
     */
    public boolean isSuccessful() {
        return accepted + rejected == rowsRead;
    }

    @Override
    public String toString() {
        return "LoadResult{read=" + rowsRead +
                ", accepted=" + accepted +
                ", rejected=" + rejected +
                ", byReason=" + byReason + '}';
    }
}
