package com.shardsql.expression;

import com.shardsql.types.BooleanType;
import com.shardsql.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an IN predicate over a list of values.
 *
 * <p>Examples:
 * <pre>
 *   status IN ('active', 'pending')
 *   id NOT IN (1, 2, 3)
 * </pre>
 *
 * <p>An IN predicate with an empty value list is legal in the host but has no
 * SQL spelling, so the builder rejects it.
 */
public final class InExpression implements Expression {

    private final Expression value;
    private final List<Expression> list;
    private final boolean negated;

    public InExpression(Expression value, List<Expression> list, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.list = new ArrayList<>(Objects.requireNonNull(list, "list must not be null"));
        this.negated = negated;
    }

    public InExpression(Expression value, List<Expression> list) {
        this(value, list, false);
    }

    public Expression value() {
        return value;
    }

    public List<Expression> list() {
        return Collections.unmodifiableList(list);
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return value.nullable() || list.stream().anyMatch(Expression::nullable);
    }

    @Override
    public List<Expression> children() {
        List<Expression> all = new ArrayList<>(list.size() + 1);
        all.add(value);
        all.addAll(list);
        return Collections.unmodifiableList(all);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public String toString() {
        return String.format("%s %sIN %s", value, negated ? "NOT " : "", list);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               Objects.equals(value, that.value) &&
               Objects.equals(list, that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, list, negated);
    }
}
