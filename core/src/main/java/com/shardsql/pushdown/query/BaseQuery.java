package com.shardsql.pushdown.query;

import com.shardsql.catalog.DistributionDescriptor;
import com.shardsql.catalog.DistributionDescriptor.KeyColumn;
import com.shardsql.catalog.RemoteTable;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.ExprId;
import com.shardsql.pushdown.QueryAlias;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.shardsql.generator.SQLQuoting.quoteIdentifier;
import static com.shardsql.generator.SQLQuoting.quoteTableName;

/**
 * Leaf query reading a remote table directly.
 *
 * <p>SQL generation:
 * <pre>SELECT `col1`, `col2` FROM `database`.`table`</pre>
 * The columns are listed explicitly so the leaf produces exactly its declared
 * output, in order.
 *
 * @param alias the node alias
 * @param table the remote table
 * @param output the columns read, never empty; names are remote column names
 */
public record BaseQuery(QueryAlias alias, RemoteTable table, List<AttributeReference> output)
    implements AbstractQuery {

    public BaseQuery {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(table, "table must not be null");
        output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
        if (output.isEmpty()) {
            throw new IllegalArgumentException("base query must read at least one column of " + table);
        }
    }

    public DistributionDescriptor distribution() {
        return table.distribution();
    }

    /**
     * Returns the table's shard key as output columns, matched by name. The key
     * is only carried when every key column is read.
     */
    @Override
    public List<ShardKey> shardKeys() {
        DistributionDescriptor distribution = distribution();
        if (distribution.isReplicated() || distribution.shardKey().isEmpty()) {
            return Collections.emptyList();
        }
        List<ExprId> columns = new ArrayList<>(distribution.shardKey().size());
        for (KeyColumn keyColumn : distribution.shardKey()) {
            Optional<AttributeReference> column = output.stream()
                .filter(attribute -> attribute.name().equalsIgnoreCase(keyColumn.name()))
                .findFirst();
            if (column.isEmpty()) {
                return Collections.emptyList();
            }
            columns.add(column.get().exprId());
        }
        return List.of(new ShardKey(columns));
    }

    @Override
    public List<AbstractQuery> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        List<String> names = new ArrayList<>(output.size());
        for (AttributeReference attribute : output) {
            names.add(quoteIdentifier(attribute.name()));
        }
        return "SELECT " + String.join(", ", names) + " FROM " + quoteTableName(table.database(), table.name());
    }
}
