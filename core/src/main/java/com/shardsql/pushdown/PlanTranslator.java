package com.shardsql.pushdown;

import com.shardsql.catalog.RelationCatalog;
import com.shardsql.catalog.RemoteTable;
import com.shardsql.config.PushdownConfig;
import com.shardsql.exception.UnsupportedExpressionException;
import com.shardsql.expression.Alias;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.ExprId;
import com.shardsql.expression.Expression;
import com.shardsql.expression.ExpressionUtils;
import com.shardsql.expression.Literal;
import com.shardsql.expression.SortOrder;
import com.shardsql.generator.QualifiedAttribute;
import com.shardsql.generator.SQLBuilder;
import com.shardsql.logical.Aggregate;
import com.shardsql.logical.BaseRelation;
import com.shardsql.logical.Filter;
import com.shardsql.logical.Join;
import com.shardsql.logical.Limit;
import com.shardsql.logical.LogicalPlan;
import com.shardsql.logical.PlanVisitor;
import com.shardsql.logical.Project;
import com.shardsql.logical.Sort;
import com.shardsql.logical.SubqueryAlias;
import com.shardsql.logical.Unrecognized;
import com.shardsql.pushdown.query.AbstractQuery;
import com.shardsql.pushdown.query.BaseQuery;
import com.shardsql.pushdown.query.JoinQuery;
import com.shardsql.pushdown.query.PartialQuery;
import com.shardsql.pushdown.query.ShardKey;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a normalized logical plan into a tree of remote subqueries.
 *
 * <p>Each recognized node becomes one aliased subquery over its translated
 * children:
 * <pre>
 *   Filter     SELECT * FROM (child) AS `a` WHERE cond
 *   Project    SELECT e AS `f_0`, ... FROM (child) AS `a`
 *   Aggregate  SELECT agg AS `f_0`, ... FROM (child) AS `a` GROUP BY g, ...
 *   Sort       SELECT * FROM (child) AS `a` ORDER BY o, ... LIMIT n
 *   Limit      SELECT * FROM (child) AS `a` LIMIT n
 *   Join       SELECT l.x AS `f_0`, ... FROM (left) AS `l` INNER JOIN (right) AS `r` ON cond
 *   Relation   SELECT `x`, ... FROM `db`.`table`
 * </pre>
 *
 * <p>Translation fails closed: a node that is not modeled, or whose child did
 * not translate, or whose expressions cannot be rendered exactly, yields empty,
 * and so does every ancestor. Empty is never an error; the host then runs the
 * plan itself.
 *
 * <p>A translator is created per compilation and shares that compilation's
 * {@link CompilationContext}. It is not thread-safe.
 */
public final class PlanTranslator implements PlanVisitor<Optional<AbstractQuery>, QueryAlias> {

    private static final Logger logger = LoggerFactory.getLogger(PlanTranslator.class);

    /**
     * Limit given to a sort with no limit of its own. The remote engine only
     * guarantees the order of a subquery's rows when it carries a LIMIT.
     */
    static final Literal MAX_LIMIT = Literal.of(Long.MAX_VALUE);

    private final RelationCatalog catalog;
    private final PushdownConfig config;
    private final CompilationContext context;

    public PlanTranslator(RelationCatalog catalog, PushdownConfig config, CompilationContext context) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Translates a plan subtree.
     *
     * @param plan the plan, already normalized
     * @param alias the alias of the subquery that will represent {@code plan}
     * @return the query tree, or empty if the subtree cannot be pushed down
     */
    public Optional<AbstractQuery> translate(LogicalPlan plan, QueryAlias alias) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
        return plan.accept(this, alias);
    }

    @Override
    public Optional<AbstractQuery> visitFilter(Filter filter, QueryAlias alias) {
        return translate(filter.child(), alias.child()).flatMap(child ->
            build(filter, () -> {
                String suffix = SQLBuilder.withFields(child.qualifiedOutput())
                    .raw(" WHERE ")
                    .addExpression(filter.condition())
                    .sql();
                return new PartialQuery(alias, child, child.output(), Optional.empty(), Optional.of(suffix));
            }));
    }

    @Override
    public Optional<AbstractQuery> visitProject(Project project, QueryAlias alias) {
        if (project.projections().isEmpty()) {
            // Normally removed by PlanNormalizer; SELECT with nothing is not valid
            return reject(project, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
        }
        return translate(project.child(), alias.child()).flatMap(child ->
            build(project, () -> {
                List<Alias> renamed = FieldRenamer.rename(project.projections(), context);
                String prefix = SQLBuilder.withFields(child.qualifiedOutput())
                    .addExpressions(renamed, ", ")
                    .sql();
                return new PartialQuery(alias, child, ExpressionUtils.toAttributes(renamed),
                    Optional.of(prefix), Optional.empty());
            }));
    }

    @Override
    public Optional<AbstractQuery> visitAggregate(Aggregate aggregate, QueryAlias alias) {
        if (aggregate.aggregateExpressions().isEmpty()) {
            // One empty row or none at all: left to the host
            return reject(aggregate, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
        }
        for (Expression grouping : aggregate.groupingExpressions()) {
            if (ExpressionUtils.containsAggregate(grouping)) {
                return reject(aggregate, FallbackReason.UNSUPPORTED_EXPRESSION);
            }
        }
        return translate(aggregate.child(), alias.child()).flatMap(child ->
            build(aggregate, () -> {
                List<QualifiedAttribute> scope = child.qualifiedOutput();
                List<Alias> renamed = FieldRenamer.rename(aggregate.aggregateExpressions(), context);
                String prefix = SQLBuilder.withFields(scope)
                    .allowingAggregates()
                    .addExpressions(renamed, ", ")
                    .sql();
                Optional<String> suffix = SQLBuilder.withFields(scope)
                    .raw(" GROUP BY ")
                    .maybeAddExpressions(aggregate.groupingExpressions(), ", ")
                    .map(SQLBuilder::sql);
                return new PartialQuery(alias, child, ExpressionUtils.toAttributes(renamed),
                    Optional.of(prefix), suffix, groupedShardKeys(child, aggregate.groupingExpressions()));
            }));
    }

    /**
     * Keeps the child's shard keys whose every column is a bare grouping
     * column. Grouping on anything else gathers rows from different partitions.
     */
    private static List<ShardKey> groupedShardKeys(AbstractQuery child, List<Expression> groupings) {
        Set<ExprId> grouped = new HashSet<>();
        for (Expression grouping : groupings) {
            if (grouping instanceof AttributeReference) {
                grouped.add(((AttributeReference) grouping).exprId());
            }
        }
        List<ShardKey> keys = new ArrayList<>();
        for (ShardKey key : child.shardKeys()) {
            if (grouped.containsAll(key.columns())) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public Optional<AbstractQuery> visitSort(Sort sort, QueryAlias alias) {
        if (!sort.isGlobal()) {
            return reject(sort, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
        }
        if (sort.child() instanceof Limit) {
            Limit limit = (Limit) sort.child();
            return sortAndLimit(sort, sort.sortOrders(), limit.limitExpression(), limit.child(), alias);
        }
        return sortAndLimit(sort, sort.sortOrders(), MAX_LIMIT, sort.child(), alias);
    }

    @Override
    public Optional<AbstractQuery> visitLimit(Limit limit, QueryAlias alias) {
        if (limit.child() instanceof Sort) {
            Sort sort = (Sort) limit.child();
            if (!sort.isGlobal()) {
                return reject(sort, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
            }
            return sortAndLimit(limit, sort.sortOrders(), limit.limitExpression(), sort.child(), alias);
        }
        return sortAndLimit(limit, List.of(), limit.limitExpression(), limit.child(), alias);
    }

    /**
     * Translates a sort and/or limit collapsed into one subquery. With no sort
     * orders only the LIMIT clause is emitted.
     */
    private Optional<AbstractQuery> sortAndLimit(LogicalPlan node, List<SortOrder> orders,
                                                 Expression limit, LogicalPlan input, QueryAlias alias) {
        if (!isValidLimit(limit)) {
            logger.debug("Limit {} is not a non-negative integral literal", limit);
            return reject(node, FallbackReason.UNSUPPORTED_EXPRESSION);
        }
        return translate(input, alias.child()).flatMap(child ->
            build(node, () -> {
                SQLBuilder builder = SQLBuilder.withFields(child.qualifiedOutput());
                if (!orders.isEmpty()) {
                    builder.raw(" ORDER BY ").addExpressions(orders, ", ");
                }
                String suffix = builder.raw(" LIMIT ").addExpression(limit).sql();
                return new PartialQuery(alias, child, child.output(), Optional.empty(), Optional.of(suffix));
            }));
    }

    private static boolean isValidLimit(Expression limit) {
        if (!(limit instanceof Literal)) {
            return false;
        }
        Literal literal = (Literal) limit;
        if (literal.isNull() || !literal.dataType().isIntegral()) {
            return false;
        }
        return ((Number) literal.value()).longValue() >= 0;
    }

    @Override
    public Optional<AbstractQuery> visitJoin(Join join, QueryAlias alias) {
        if (join.joinType() != Join.JoinType.INNER) {
            return reject(join, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
        }
        if (!config.isJoinsEnabled()) {
            return reject(join, FallbackReason.DISABLED);
        }

        QueryAlias.Fork fork = alias.fork();
        Optional<AbstractQuery> left = translate(join.left(), fork.left().child());
        if (left.isEmpty()) {
            return Optional.empty();
        }
        Optional<AbstractQuery> right = translate(join.right(), fork.right().child());
        if (right.isEmpty()) {
            return Optional.empty();
        }
        if (!ColocationPredicate.sharesCluster(left.get(), right.get(), join.condition())) {
            return reject(join, FallbackReason.INCOMPATIBLE_DISTRIBUTION);
        }

        AbstractQuery l = left.get();
        AbstractQuery r = right.get();
        return build(join, () -> {
            List<QualifiedAttribute> scope = new ArrayList<>(l.qualifiedOutput());
            scope.addAll(r.qualifiedOutput());

            List<Alias> renamed = FieldRenamer.rename(join.output(), context);
            String projection = SQLBuilder.withFields(scope)
                .addExpressions(renamed, ", ")
                .sql();
            Optional<String> condition = join.condition()
                .map(c -> SQLBuilder.withFields(scope).addExpression(c).sql());
            return new JoinQuery(alias, l, r, ExpressionUtils.toAttributes(renamed), projection, condition);
        });
    }

    @Override
    public Optional<AbstractQuery> visitBaseRelation(BaseRelation relation, QueryAlias alias) {
        if (relation.output().isEmpty()) {
            // SELECT * would return columns the plan does not declare
            return reject(relation, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
        }
        Optional<RemoteTable> table = catalog.lookup(relation.handle());
        if (table.isEmpty()) {
            return reject(relation, FallbackReason.UNRESOLVED_RELATION);
        }
        return Optional.of(new BaseQuery(alias, table.get(), relation.output()));
    }

    @Override
    public Optional<AbstractQuery> visitSubqueryAlias(SubqueryAlias subqueryAlias, QueryAlias alias) {
        // Output ids are unchanged by a subquery alias, so it has no SQL of its own
        return translate(subqueryAlias.child(), alias);
    }

    @Override
    public Optional<AbstractQuery> visitUnrecognized(Unrecognized unrecognized, QueryAlias alias) {
        return reject(unrecognized, FallbackReason.UNSUPPORTED_PLAN_SHAPE);
    }

    /**
     * Builds the query for a recognized node, turning an unrenderable
     * expression into empty.
     */
    private Optional<AbstractQuery> build(LogicalPlan node, Supplier<AbstractQuery> body) {
        try {
            return Optional.of(body.get());
        } catch (UnsupportedExpressionException e) {
            logger.debug("Cannot render {}: {}", node.getClass().getSimpleName(), e.getMessage());
            return reject(node, FallbackReason.UNSUPPORTED_EXPRESSION);
        }
    }

    private static Optional<AbstractQuery> reject(LogicalPlan node, FallbackReason reason) {
        if (logger.isDebugEnabled()) {
            logger.debug("Not pushing down {}: {}", node.getClass().getSimpleName(), reason);
        }
        return Optional.empty();
    }
}
