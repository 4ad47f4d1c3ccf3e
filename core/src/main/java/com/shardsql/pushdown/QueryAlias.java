package com.shardsql.pushdown;

import java.util.Objects;

/**
 * Path-shaped name of a generated subquery.
 *
 * <p>An alias is a prefix plus a height. Descending into the single child of a
 * node increments the height; descending into the two sides of a join forks
 * the prefix into {@code _l} and {@code _r} branches. The rendered form is
 * {@code <prefix>_<height>}:
 * <pre>
 *   query_0                   root
 *   query_1                   its child
 *   query_l_2 / query_r_2     the two sides of a join at query_1
 * </pre>
 * A prefix is the root name followed by {@code _l}/{@code _r} segments, and the
 * height is the only numeric segment, so distinct (prefix, height) pairs render
 * to distinct strings. Within one fork branch the nodes form a chain of
 * increasing height, so no two nodes of a tree share a pair.
 *
 * @param prefix the fork path
 * @param height depth below the root
 */
public record QueryAlias(String prefix, int height) {

    public QueryAlias {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (height < 0) {
            throw new IllegalArgumentException("height must not be negative, got: " + height);
        }
    }

    /**
     * Creates the alias of a tree root.
     *
     * @param prefix the root name
     * @return the alias at height 0
     */
    public static QueryAlias root(String prefix) {
        return new QueryAlias(prefix, 0);
    }

    /**
     * Returns the alias for the single child of the node that owns this alias.
     *
     * @return the child alias
     */
    public QueryAlias child() {
        return new QueryAlias(prefix, height + 1);
    }

    /**
     * Splits this alias into two independent paths for the sides of a join.
     * Callers still take {@link #child()} of each side for the side's root.
     *
     * @return the left and right paths
     */
    public Fork fork() {
        return new Fork(new QueryAlias(prefix + "_l", height), new QueryAlias(prefix + "_r", height));
    }

    @Override
    public String toString() {
        return prefix + "_" + height;
    }

    /**
     * The two branches of a forked alias.
     *
     * @param left the left branch
     * @param right the right branch
     */
    public record Fork(QueryAlias left, QueryAlias right) {}
}
