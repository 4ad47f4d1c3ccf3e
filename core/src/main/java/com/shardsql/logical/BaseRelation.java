package com.shardsql.logical;

import com.shardsql.catalog.RelationHandle;
import com.shardsql.expression.AttributeReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node reading a relation known to the host.
 *
 * <p>Whether the relation is a remote table is decided by the
 * {@link com.shardsql.catalog.RelationCatalog}, not by this node: the same node
 * kind covers remote tables, local datasets and computed relations.
 */
public final class BaseRelation extends LogicalPlan {

    private final RelationHandle handle;
    private final List<AttributeReference> output;

    /**
     * Creates a base relation node.
     *
     * @param handle the host relation identifier
     * @param output the columns read, in output order; names are remote column names
     */
    public BaseRelation(RelationHandle handle, List<AttributeReference> output) {
        super();
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.output = new ArrayList<>(Objects.requireNonNull(output, "output must not be null"));
    }

    public RelationHandle handle() {
        return handle;
    }

    @Override
    public List<AttributeReference> output() {
        return Collections.unmodifiableList(output);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkChildCount(newChildren, 0);
        return this;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitBaseRelation(this, context);
    }

    @Override
    public String toString() {
        return String.format("BaseRelation(%s, %s)", handle, output);
    }
}
