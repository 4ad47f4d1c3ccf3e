package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort (ORDER BY clause).
 *
 * <p>A global sort orders the whole result. A non-global sort only orders rows
 * within each partition of the host's execution and has no SQL equivalent.
 *
 * <p>Examples:
 * <pre>
 *   df.orderBy("name")                    // global
 *   df.sortWithinPartitions("name")       // non-global
 * </pre>
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;
    private final boolean global;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort orders
     * @param global whether the sort orders the entire result
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders, boolean global) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));
        this.global = global;

        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    /**
     * Creates a global sort node.
     *
     * @param child the child node
     * @param sortOrders the sort orders
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        this(child, sortOrders, true);
    }

    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
    }

    public boolean isGlobal() {
        return global;
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
        return new Sort(newChildren.get(0), sortOrders, global);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitSort(this, context);
    }

    @Override
    public String toString() {
        return String.format("Sort(%s, global=%s)", sortOrders, global);
    }
}
