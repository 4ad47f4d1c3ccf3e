package com.shardsql.pushdown.query;

import com.shardsql.expression.AttributeReference;
import com.shardsql.pushdown.QueryAlias;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.shardsql.generator.SQLQuoting.quoteIdentifier;

/**
 * Query wrapping exactly one child in a new aliased subquery.
 *
 * <p>SQL generation:
 * <pre>SELECT prefix FROM (inner) AS `inner_alias` suffix</pre>
 * where an absent prefix means {@code *} and an absent suffix means nothing.
 * The prefix is a SELECT list; the suffix holds WHERE, GROUP BY, ORDER BY and
 * LIMIT clauses, rendered against the inner query's qualified output.
 *
 * <p>Unless given explicitly, the shard keys are those of {@code inner} that
 * {@code output} still produces. An aggregation passes only the keys it groups on.
 *
 * @param alias the node alias
 * @param inner the wrapped query
 * @param output the columns this node produces
 * @param prefix the SELECT list, or empty for {@code *}
 * @param suffix the trailing clauses, with a leading space
 * @param shardKeys the shard keys carried to the output
 */
public record PartialQuery(QueryAlias alias, AbstractQuery inner, List<AttributeReference> output,
                           Optional<String> prefix, Optional<String> suffix, List<ShardKey> shardKeys)
    implements AbstractQuery {

    public PartialQuery {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(inner, "inner must not be null");
        output = List.copyOf(Objects.requireNonNull(output, "output must not be null"));
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(suffix, "suffix must not be null");
        shardKeys = ShardKey.carriedBy(Objects.requireNonNull(shardKeys, "shardKeys must not be null"), output);
    }

    public PartialQuery(QueryAlias alias, AbstractQuery inner, List<AttributeReference> output,
                        Optional<String> prefix, Optional<String> suffix) {
        this(alias, inner, output, prefix, suffix,
            Objects.requireNonNull(inner, "inner must not be null").shardKeys());
    }

    @Override
    public List<AbstractQuery> children() {
        return Collections.singletonList(inner);
    }

    @Override
    public String toSQL() {
        return "SELECT " + prefix.orElse("*")
            + " FROM (" + inner.toSQL() + ") AS " + quoteIdentifier(inner.alias().toString())
            + suffix.orElse("");
    }
}
