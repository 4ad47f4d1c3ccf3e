package com.shardsql.pushdown.query;

import com.shardsql.expression.AttributeReference;
import com.shardsql.generator.QualifiedAttribute;
import com.shardsql.pushdown.QueryAlias;
import java.util.ArrayList;
import java.util.List;

/**
 * A node of the compiled SQL query tree.
 *
 * <p>Each node is one aliased subquery. Parents may only reference a node
 * through its {@link #qualifiedOutput()}.
 *
 * <p>Trees are built bottom-up once per logical plan, are immutable, and are
 * compared structurally: compiling the same plan twice yields equal trees.
 */
public sealed interface AbstractQuery permits BaseQuery, PartialQuery, JoinQuery {

    /**
     * Returns the alias this node is known by in its parent's FROM clause.
     *
     * @return the alias
     */
    QueryAlias alias();

    /**
     * Returns the columns this node produces, in order.
     *
     * @return the output attributes
     */
    List<AttributeReference> output();

    /**
     * Returns the direct subqueries of this node.
     *
     * @return the children, empty for a base query
     */
    List<AbstractQuery> children();

    /**
     * Returns the shard keys of sharded base tables beneath this node that
     * are still present in its output.
     *
     * @return the carried shard keys, empty if none survived or every base table is replicated
     */
    List<ShardKey> shardKeys();

    /**
     * Renders this node and its subtree as one SELECT statement.
     *
     * @return the SQL text
     */
    String toSQL();

    /**
     * Returns this node's output qualified by its alias; this is what a parent's
     * SQL fragments are rendered against.
     *
     * @return the qualified output
     */
    default List<QualifiedAttribute> qualifiedOutput() {
        String qualifier = alias().toString();
        List<QualifiedAttribute> result = new ArrayList<>(output().size());
        for (AttributeReference attribute : output()) {
            result.add(new QualifiedAttribute(qualifier, attribute));
        }
        return result;
    }

    /**
     * Returns every base query in this subtree, left to right.
     *
     * @return the leaves
     */
    default List<BaseQuery> baseQueries() {
        List<BaseQuery> result = new ArrayList<>();
        collectBaseQueries(this, result);
        return result;
    }

    private static void collectBaseQueries(AbstractQuery query, List<BaseQuery> result) {
        if (query instanceof BaseQuery) {
            result.add((BaseQuery) query);
            return;
        }
        for (AbstractQuery child : query.children()) {
            collectBaseQueries(child, result);
        }
    }
}
