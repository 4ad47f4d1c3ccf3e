package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sort key: an expression plus direction and null handling.
 *
 * <p>When no null ordering is given, ascending keys sort nulls first and
 * descending keys sort nulls last. That default is also what the remote engine
 * does, so only the non-default orderings need extra SQL.
 */
public final class SortOrder implements Expression {

    /**
     * Sort direction.
     */
    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }

    private final Expression child;
    private final Direction direction;
    private final NullOrdering nullOrdering;

    public SortOrder(Expression child, Direction direction, NullOrdering nullOrdering) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering must not be null");
    }

    public SortOrder(Expression child, Direction direction) {
        this(child, direction,
             direction == Direction.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
    }

    public static SortOrder asc(Expression child) {
        return new SortOrder(child, Direction.ASCENDING);
    }

    public static SortOrder desc(Expression child) {
        return new SortOrder(child, Direction.DESCENDING);
    }

    public Expression child() {
        return child;
    }

    public Direction direction() {
        return direction;
    }

    public NullOrdering nullOrdering() {
        return nullOrdering;
    }

    /**
     * Returns whether the null ordering is the one the direction implies by default.
     *
     * @return true for ASC NULLS FIRST and DESC NULLS LAST
     */
    public boolean hasDefaultNullOrdering() {
        return direction == Direction.ASCENDING
            ? nullOrdering == NullOrdering.NULLS_FIRST
            : nullOrdering == NullOrdering.NULLS_LAST;
    }

    @Override
    public DataType dataType() {
        return child.dataType();
    }

    @Override
    public boolean nullable() {
        return child.nullable();
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(child);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSortOrder(this);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", child, direction, nullOrdering);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return direction == that.direction &&
               nullOrdering == that.nullOrdering &&
               Objects.equals(child, that.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, direction, nullOrdering);
    }
}
