package com.shardsql.pushdown;

/**
 * Why a plan node was left to the host.
 */
public enum FallbackReason {
    /** The node kind, join kind or sort mode is not modeled. */
    UNSUPPORTED_PLAN_SHAPE,
    /** An expression of the node has no exact SQL rendering. */
    UNSUPPORTED_EXPRESSION,
    /** The sides of a join cannot be proven co-located. */
    INCOMPATIBLE_DISTRIBUTION,
    /** The relation is not backed by a remote table. */
    UNRESOLVED_RELATION,
    /** Pushdown, or this kind of pushdown, is switched off. */
    DISABLED,
    /** An internal invariant failed on a recognized shape. */
    STRUCTURAL_INCONSISTENCY
}
