package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a type cast: {@code CAST(expr AS type)}.
 */
public final class CastExpression implements Expression {

    private final Expression child;
    private final DataType targetType;

    public CastExpression(Expression child, DataType targetType) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression child() {
        return child;
    }

    public DataType targetType() {
        return targetType;
    }

    @Override
    public DataType dataType() {
        return targetType;
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
        return visitor.visitCast(this);
    }

    @Override
    public String toString() {
        return String.format("CAST(%s AS %s)", child, targetType);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return Objects.equals(child, that.child) && Objects.equals(targetType, that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, targetType);
    }
}
