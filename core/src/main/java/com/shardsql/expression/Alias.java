package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression that gives a name to another expression in a SELECT list.
 *
 * <p>Examples:
 * <pre>
 *   price * quantity AS total
 *   SUM(amount) AS total_amount
 * </pre>
 *
 * <p>The alias owns the {@link ExprId} of its output; parents refer to it through
 * {@link #toAttribute()}.
 */
public final class Alias implements NamedExpression {

    private final Expression child;
    private final String name;
    private final ExprId exprId;

    /**
     * Creates an alias expression.
     *
     * @param child the expression to alias
     * @param name the alias name
     * @param exprId the id of the aliased output
     */
    public Alias(Expression child, String name, ExprId exprId) {
        this.child = Objects.requireNonNull(child, "child must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
    }

    /**
     * Creates an alias with a freshly allocated id.
     *
     * @param child the expression to alias
     * @param name the alias name
     * @return the alias
     */
    public static Alias of(Expression child, String name) {
        return new Alias(child, name, ExprId.next());
    }

    public Expression child() {
        return child;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExprId exprId() {
        return exprId;
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
    public AttributeReference toAttribute() {
        return new AttributeReference(name, child.dataType(), child.nullable(), exprId);
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(child);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAlias(this);
    }

    @Override
    public String toString() {
        return child + " AS " + name + exprId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return Objects.equals(child, that.child) &&
               Objects.equals(name, that.name) &&
               Objects.equals(exprId, that.exprId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(child, name, exprId);
    }
}
