package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.Expression;
import com.shardsql.expression.Literal;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a row limit (LIMIT clause).
 *
 * <p>The limit is an expression because that is how the host carries it; in
 * practice it is an integral literal, and only that form is pushed down.
 */
public final class Limit extends LogicalPlan {

    private final Expression limitExpression;

    /**
     * Creates a limit node.
     *
     * @param child the child node
     * @param limitExpression the maximum number of rows
     */
    public Limit(LogicalPlan child, Expression limitExpression) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.limitExpression = Objects.requireNonNull(limitExpression, "limitExpression must not be null");
    }

    /**
     * Creates a limit node with a literal row count.
     *
     * @param child the child node
     * @param limit the maximum number of rows
     * @return the limit node
     */
    public static Limit of(LogicalPlan child, int limit) {
        return new Limit(child, Literal.of(limit));
    }

    public Expression limitExpression() {
        return limitExpression;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 1);
        return new Limit(newChildren.get(0), limitExpression);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLimit(this, context);
    }

    @Override
    public String toString() {
        return String.format("Limit(%s)", limitExpression);
    }
}
