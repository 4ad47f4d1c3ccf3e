package com.shardsql.expression;

/**
 * Visitor over the closed set of expression kinds.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitAttributeReference(AttributeReference attribute);

    R visitAlias(Alias alias);

    R visitLiteral(Literal literal);

    R visitBinary(BinaryExpression binary);

    R visitUnary(UnaryExpression unary);

    R visitIn(InExpression in);

    R visitCast(CastExpression cast);

    R visitFunctionCall(FunctionCall function);

    R visitAggregateFunction(AggregateFunction aggregate);

    R visitSortOrder(SortOrder sortOrder);

    R visitOpaque(OpaqueExpression opaque);
}
