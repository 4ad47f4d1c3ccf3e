package com.shardsql.logical;

/**
 * Visitor over the closed set of logical plan node kinds.
 *
 * @param <R> the result type
 * @param <C> the context type threaded through the traversal
 */
public interface PlanVisitor<R, C> {

    R visitFilter(Filter filter, C context);

    R visitProject(Project project, C context);

    R visitAggregate(Aggregate aggregate, C context);

    R visitSort(Sort sort, C context);

    R visitLimit(Limit limit, C context);

    R visitJoin(Join join, C context);

    R visitBaseRelation(BaseRelation relation, C context);

    R visitSubqueryAlias(SubqueryAlias subqueryAlias, C context);

    R visitUnrecognized(Unrecognized unrecognized, C context);
}
