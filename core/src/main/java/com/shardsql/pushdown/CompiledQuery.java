package com.shardsql.pushdown;

import com.shardsql.pushdown.query.AbstractQuery;
import java.util.List;
import java.util.Objects;

/**
 * The result of a successful pushdown: a single SELECT statement for the remote
 * engine and the mapping of its result columns back to the host plan's output.
 *
 * @param sql the statement
 * @param columns the result columns, in the order of the plan's output
 * @param tree the query tree the statement was rendered from
 */
public record CompiledQuery(String sql, List<OutputColumn> columns, AbstractQuery tree) {

    public CompiledQuery {
        Objects.requireNonNull(sql, "sql must not be null");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        Objects.requireNonNull(tree, "tree must not be null");
    }
}
