package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.ExpressionUtils;
import com.shardsql.expression.NamedExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>This node computes a new row for each input row from a list of named
 * expressions: bare column references or aliased computations.
 *
 * <p>Examples:
 * <pre>
 *   df.select("name", "age")
 *   df.select(col("price").multiply(col("quantity")).as("total"))
 * </pre>
 *
 * <p>The host optimizer sometimes produces a projection with no expressions
 * (a row-count over pruned columns). Such a node is removed by
 * {@link PlanNormalizer} before translation.
 */
public final class Project extends LogicalPlan {

    private final List<NamedExpression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projected expressions, possibly empty
     */
    public Project(LogicalPlan child, List<? extends NamedExpression> projections) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.projections = new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null"));
    }

    /**
     * Returns the projection expressions.
     *
     * @return an unmodifiable list of projections
     */
    public List<NamedExpression> projections() {
        return Collections.unmodifiableList(projections);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return ExpressionUtils.toAttributes(projections);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 1);
        return new Project(newChildren.get(0), projections);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitProject(this, context);
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
