package com.shardsql.logical;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a host plan into the shape the pushdown translator expects.
 *
 * <p>Two rewrites are applied bottom-up:
 * <ul>
 *   <li>a {@link Project} with no expressions is replaced by its child</li>
 *   <li>a {@link SubqueryAlias} is replaced by its child</li>
 * </ul>
 * Neither changes the rows the plan produces. An empty projection must never
 * reach SQL generation, since {@code SELECT} with nothing after it is not valid.
 */
public final class PlanNormalizer {

    private PlanNormalizer() {}

    /**
     * Normalizes a plan.
     *
     * @param plan the host plan
     * @return the normalized plan, or the same instance when nothing changed
     */
    public static LogicalPlan normalize(LogicalPlan plan) {
        List<LogicalPlan> children = plan.children();
        List<LogicalPlan> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (LogicalPlan child : children) {
            LogicalPlan normalized = normalize(child);
            changed |= normalized != child;
            newChildren.add(normalized);
        }
        LogicalPlan node = changed ? plan.withNewChildren(newChildren) : plan;

        if (node instanceof Project && ((Project) node).projections().isEmpty()) {
            return ((Project) node).child();
        }
        if (node instanceof SubqueryAlias) {
            return ((SubqueryAlias) node).child();
        }
        return node;
    }
}
