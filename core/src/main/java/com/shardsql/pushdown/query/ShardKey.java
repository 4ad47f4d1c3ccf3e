package com.shardsql.pushdown.query;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.ExprId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output columns of a query that hold the shard key of a sharded base table
 * beneath it, in key order.
 *
 * <p>Rows with equal values in these columns were read from the same
 * partition. A query may carry several keys, one per sharded table whose key
 * survived up to its output; after a co-located join they are equal row by row.
 *
 * @param columns ids of the key columns, never empty
 */
public record ShardKey(List<ExprId> columns) {

    public ShardKey {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("shard key must have at least one column");
        }
    }

    public int arity() {
        return columns.size();
    }

    /**
     * Keeps the keys whose every column is still produced by {@code output}.
     *
     * @param keys the candidate keys
     * @param output the output of the query that would carry them
     * @return the surviving keys, in order
     */
    public static List<ShardKey> carriedBy(List<ShardKey> keys, List<AttributeReference> output) {
        Set<ExprId> produced = new HashSet<>();
        for (AttributeReference attribute : output) {
            produced.add(attribute.exprId());
        }
        List<ShardKey> result = new ArrayList<>(keys.size());
        for (ShardKey key : keys) {
            if (produced.containsAll(key.columns)) {
                result.add(key);
            }
        }
        return List.copyOf(result);
    }
}
