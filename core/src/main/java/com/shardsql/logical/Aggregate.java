package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.Expression;
import com.shardsql.expression.ExpressionUtils;
import com.shardsql.expression.NamedExpression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation (GROUP BY clause with aggregates).
 *
 * <p>This node groups rows from its child and computes aggregate functions.
 * Grouping expressions that should appear in the output are repeated in the
 * aggregate list, the way the host's optimizer lays them out.
 *
 * <p>Examples:
 * <pre>
 *   df.groupBy("category").agg(sum("amount"), avg("price"))
 *   df.groupBy("year", "month").count()
 * </pre>
 *
 * <p>Pushed down as:
 * <pre>
 * SELECT aggregateExpr1, aggregateExpr2
 * FROM (child) AS alias
 * GROUP BY groupingExpr1, groupingExpr2
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<NamedExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions (empty for global aggregation)
     * @param aggregateExpressions the output expressions (aggregates and grouping columns)
     */
    public Aggregate(LogicalPlan child,
                     List<? extends Expression> groupingExpressions,
                     List<? extends NamedExpression> aggregateExpressions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.groupingExpressions = new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null"));
        this.aggregateExpressions = new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
    }

    public List<Expression> groupingExpressions() {
        return Collections.unmodifiableList(groupingExpressions);
    }

    public List<NamedExpression> aggregateExpressions() {
        return Collections.unmodifiableList(aggregateExpressions);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<AttributeReference> output() {
        return ExpressionUtils.toAttributes(aggregateExpressions);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 1);
        return new Aggregate(newChildren.get(0), groupingExpressions, aggregateExpressions);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitAggregate(this, context);
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, aggregates=%s)", groupingExpressions, aggregateExpressions);
    }
}
