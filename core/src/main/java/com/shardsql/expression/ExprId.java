package com.shardsql.expression;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stable identity of a named value in a logical plan.
 *
 * <p>The id survives renaming: an attribute that is re-aliased to a synthetic
 * field name keeps its id, which is how references are resolved against a
 * child query's output.
 *
 * @param id the numeric id
 */
public record ExprId(long id) {

    private static final AtomicLong NEXT = new AtomicLong();

    /**
     * Allocates a new globally unique id, the way the host optimizer does for
     * newly created attributes and aliases.
     *
     * @return a fresh id
     */
    public static ExprId next() {
        return new ExprId(NEXT.incrementAndGet());
    }

    @Override
    public String toString() {
        return "#" + id;
    }
}
