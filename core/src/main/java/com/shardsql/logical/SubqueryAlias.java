package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node that names a relation, as in {@code df.alias("t")}.
 *
 * <p>References are resolved by id, so the name carries no meaning for SQL
 * generation and the node is removed by {@link PlanNormalizer}.
 */
public final class SubqueryAlias extends LogicalPlan {

    private final String alias;

    public SubqueryAlias(LogicalPlan child, String alias) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public String alias() {
        return alias;
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
        return new SubqueryAlias(newChildren.get(0), alias);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitSubqueryAlias(this, context);
    }

    @Override
    public String toString() {
        return String.format("SubqueryAlias(%s)", alias);
    }
}
