package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all logical plan nodes handed over by the host optimizer.
 *
 * <p>This represents a node in the logical query plan tree. Each node can have
 * zero or more children and declares its ordered output attributes.
 *
 * <p>The set of node kinds is closed. Shapes the host can produce but the
 * pushdown compiler does not model arrive as {@link Unrecognized}. Consumers
 * dispatch through {@link PlanVisitor}.
 *
 * <p>Plans are immutable; {@link #withNewChildren(List)} returns a copy.
 */
public abstract sealed class LogicalPlan
    permits Filter, Project, Aggregate, Sort, Limit, Join, BaseRelation, SubqueryAlias, Unrecognized {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the attributes this node produces, in output order.
     *
     * @return the output attributes
     */
    public abstract List<AttributeReference> output();

    /**
     * Returns a copy of this node with its children replaced.
     *
     * @param newChildren the new children, same count as {@link #children()}
     * @return the copied node
     */
    public abstract LogicalPlan withNewChildren(List<LogicalPlan> newChildren);

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor
     * @param context caller-supplied context passed through unchanged
     * @param <R> the result type
     * @param <C> the context type
     * @return the visitor result
     */
    public abstract <R, C> R accept(PlanVisitor<R, C> visitor, C context);

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();

    /**
     * Renders this node and its subtree, one node per line.
     *
     * @return the indented tree string
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(this).append('\n');
        for (LogicalPlan child : children) {
            child.appendTree(sb, depth + 1);
        }
    }

    protected static void checkChildCount(List<LogicalPlan> newChildren, int expected) {
        if (newChildren.size() != expected) {
            throw new IllegalArgumentException(
                "expected " + expected + " children, got " + newChildren.size());
        }
    }
}
