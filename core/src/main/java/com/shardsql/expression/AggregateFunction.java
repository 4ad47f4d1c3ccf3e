package com.shardsql.expression;

import com.shardsql.types.DataType;
import com.shardsql.types.DoubleType;
import com.shardsql.types.LongType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing an aggregate function over the rows of a group.
 *
 * <p>Examples:
 * <pre>
 *   COUNT(*)
 *   COUNT(DISTINCT customer_id)
 *   SUM(amount)
 *   AVG(price)
 * </pre>
 *
 * <p>Aggregate functions only make sense in the aggregate list of an
 * {@link com.shardsql.logical.Aggregate} node.
 */
public final class AggregateFunction implements Expression {

    /**
     * Supported aggregate function kinds.
     */
    public enum Kind {
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX
    }

    private final Kind kind;
    private final Expression argument; // null only for COUNT(*)
    private final boolean distinct;

    /**
     * Creates an aggregate function.
     *
     * @param kind the aggregate kind
     * @param argument the aggregated expression, or null for a row count
     * @param distinct whether only distinct argument values are aggregated
     */
    public AggregateFunction(Kind kind, Expression argument, boolean distinct) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (argument == null && kind != Kind.COUNT) {
            throw new IllegalArgumentException(kind + " requires an argument");
        }
        if (argument == null && distinct) {
            throw new IllegalArgumentException("COUNT(DISTINCT *) is not a valid aggregate");
        }
        this.argument = argument;
        this.distinct = distinct;
    }

    public static AggregateFunction countStar() {
        return new AggregateFunction(Kind.COUNT, null, false);
    }

    public static AggregateFunction count(Expression argument) {
        return new AggregateFunction(Kind.COUNT, argument, false);
    }

    public static AggregateFunction countDistinct(Expression argument) {
        return new AggregateFunction(Kind.COUNT, argument, true);
    }

    public static AggregateFunction sum(Expression argument) {
        return new AggregateFunction(Kind.SUM, argument, false);
    }

    public static AggregateFunction avg(Expression argument) {
        return new AggregateFunction(Kind.AVG, argument, false);
    }

    public static AggregateFunction min(Expression argument) {
        return new AggregateFunction(Kind.MIN, argument, false);
    }

    public static AggregateFunction max(Expression argument) {
        return new AggregateFunction(Kind.MAX, argument, false);
    }

    public Kind kind() {
        return kind;
    }

    public Optional<Expression> argument() {
        return Optional.ofNullable(argument);
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Returns whether this aggregate counts every row of its group unconditionally.
     *
     * <p>That is {@code COUNT(*)} itself, or a non-distinct COUNT over a non-null
     * literal such as {@code COUNT(1)}, which is how the host spells a row count.
     *
     * @return true for an unconditional row count
     */
    public boolean isRowCount() {
        if (kind != Kind.COUNT || distinct) {
            return false;
        }
        return argument == null || (argument instanceof Literal && !((Literal) argument).isNull());
    }

    @Override
    public DataType dataType() {
        switch (kind) {
            case COUNT:
                return LongType.get();
            case AVG:
                return DoubleType.get();
            case SUM:
                return argument.dataType().isIntegral() ? LongType.get() : argument.dataType();
            default:
                return argument.dataType();
        }
    }

    @Override
    public boolean nullable() {
        return kind != Kind.COUNT;
    }

    @Override
    public List<Expression> children() {
        return argument == null ? Collections.emptyList() : Collections.singletonList(argument);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAggregateFunction(this);
    }

    @Override
    public String toString() {
        return String.format("%s(%s%s)", kind, distinct ? "DISTINCT " : "",
            argument == null ? "*" : argument);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateFunction)) return false;
        AggregateFunction that = (AggregateFunction) obj;
        return kind == that.kind &&
               distinct == that.distinct &&
               Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argument, distinct);
    }
}
