package com.affiliation.linkage.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running stage.
 * Stages poll it between record boundaries.
 */
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The NONE token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws {@link StageCancelledException} if cancellation was requested.
     */
    public void throwIfCancelled(Stage stage, long recordsProcessed) {
        if (cancelled.get()) {
            throw new StageCancelledException(stage, recordsProcessed);
        }
    }
}
