package com.shardsql.pushdown.query;

import com.shardsql.expression.AttributeReference;
import com.shardsql.pushdown.QueryAlias;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.shardsql.generator.SQLQuoting.quoteIdentifier;

/**
 * Inner join of two subqueries.
 *
 * <p>SQL generation:
 * <pre>
 * SELECT projection
 * FROM (left) AS `left_alias` INNER JOIN (right) AS `right_alias`
 * ON condition
 * </pre>
 * The projection re-aliases every column of both sides, left first, so the
 * output never has two columns of the same name.
 *
 * @param alias the node alias
 * @param left the left side
 * @param right the right side
 * @param output the columns this node produces
 * @param projection the SELECT list
 * @param condition the ON condition, or empty for an unconditioned join
 */
public record JoinQuery(QueryAlias alias, AbstractQuery left, AbstractQuery right,
                        List<AttributeReference> output, String projection, Optional<String> condition)
    implements AbstractQuery {

    public JoinQuery {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
        Objects.requireNonNull(projection, "projection must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
    }

    /**
     * Carries the keys of both sides. A join is only built once its sides are
     * known to be co-located, so the keys that survive are interchangeable.
     */
    @Override
    public List<ShardKey> shardKeys() {
        List<ShardKey> keys = new ArrayList<>(left.shardKeys());
        keys.addAll(right.shardKeys());
        return ShardKey.carriedBy(keys, output);
    }

    @Override
    public List<AbstractQuery> children() {
        return Arrays.asList(left, right);
    }

    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(projection)
           .append(" FROM (").append(left.toSQL()).append(") AS ").append(quoteIdentifier(left.alias().toString()))
           .append(" INNER JOIN (").append(right.toSQL()).append(") AS ").append(quoteIdentifier(right.alias().toString()));
        condition.ifPresent(c -> sql.append(" ON ").append(c));
        return sql.toString();
    }
}
