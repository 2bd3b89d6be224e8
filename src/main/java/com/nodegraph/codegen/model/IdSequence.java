package com.nodegraph.codegen.model;

/**
 * Monotonic id source owned by a {@link Graph}. Ids are never handed out twice,
 * even after the entity that held one is deleted.
 */
public final class IdSequence {
    private int next;

    public int next() {
        return next++;
    }

    /** The id the next call to {@link #next()} returns. */
    public int peek() {
        return next;
    }

    /** Makes sure {@code id} is never issued, e.g. after restoring it from a document. */
    public void advancePast(int id) {
        if (id >= next)
            next = id + 1;
    }

    public void reset() {
        next = 0;
    }
}
