package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.Expression;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>This node filters rows from its child based on a boolean condition.
 *
 * <p>Pushed down as:
 * <pre>SELECT * FROM (child) AS alias WHERE condition</pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public Expression condition() {
        return condition;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        // Filter doesn't change the schema
        return child().output();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 1);
        return new Filter(newChildren.get(0), condition);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitFilter(this, context);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
