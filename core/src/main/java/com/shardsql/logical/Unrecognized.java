package com.shardsql.logical;

import com.shardsql.expression.AttributeReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Any host plan node the pushdown compiler does not model: unions, distinct,
 * window, sample, local data and so on.
 *
 * <p>It keeps the host's node name for logging and its children so the tree
 * below it can still be normalized.
 */
public final class Unrecognized extends LogicalPlan {

    private final String nodeName;
    private final List<AttributeReference> output;

    /**
     * Creates an unrecognized node.
     *
     * @param nodeName the host's name for the node kind
     * @param children the child nodes
     * @param output the node's output attributes
     */
    public Unrecognized(String nodeName, List<LogicalPlan> children, List<AttributeReference> output) {
        super(children);
        this.nodeName = Objects.requireNonNull(nodeName, "nodeName must not be null");
        this.output = new ArrayList<>(Objects.requireNonNull(output, "output must not be null"));
    }

    public String nodeName() {
        return nodeName;
    }

    @Override
    public List<AttributeReference> output() {
        return Collections.unmodifiableList(output);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, children.size());
        return new Unrecognized(nodeName, newChildren, output);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitUnrecognized(this, context);
    }

    @Override
    public String toString() {
        return String.format("Unrecognized(%s)", nodeName);
    }
}
