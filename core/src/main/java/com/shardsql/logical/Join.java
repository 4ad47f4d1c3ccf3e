package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Logical plan node joining two relations on an optional condition.
 *
 * <p>The output is the left output followed by the right output. Only
 * {@link JoinType#INNER} joins are pushed down; the other types are modeled so
 * they can be recognized and refused. Semi and anti joins, whose output is the
 * left side alone, reach the compiler as {@link Unrecognized}.
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param condition the join condition (may be null)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = condition;
    }

    /**
     * Creates an inner join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param condition the join condition
     * @return the join node
     */
    public static Join inner(LogicalPlan left, LogicalPlan right, Expression condition) {
        return new Join(left, right, JoinType.INNER, condition);
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the join condition.
     *
     * @return the condition, or empty for an unconditioned join
     */
    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> output = new ArrayList<>(left().output());
        output.addAll(right().output());
        return output;
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 2);
        return new Join(newChildren.get(0), newChildren.get(1), joinType, condition);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitJoin(this, context);
    }

    @Override
    public String toString() {
        if (condition != null) {
            return String.format("Join(%s, condition=%s)", joinType, condition);
        }
        return String.format("Join(%s)", joinType);
    }

    /**
     * Join types the host can produce.
     */
    public enum JoinType {
        INNER,
        LEFT_OUTER,
        RIGHT_OUTER,
        FULL_OUTER,
        CROSS
    }
}
