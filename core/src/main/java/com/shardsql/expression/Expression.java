package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.List;

/**
 * Base interface for all host expressions handed to the pushdown compiler.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references ({@link AttributeReference})</li>
 *   <li>Arithmetic, comparison and logical operations</li>
 *   <li>Scalar function calls and aggregate functions</li>
 * </ul>
 *
 * <p>The set of expression kinds is closed. Host expressions that have no
 * counterpart here are handed over as {@link OpaqueExpression}, which the SQL
 * builder refuses to render. Consumers dispatch through
 * {@link ExpressionVisitor}, so a new kind cannot be added without every
 * visitor handling it.
 */
public sealed interface Expression
    permits NamedExpression, Literal, BinaryExpression, UnaryExpression, InExpression,
            CastExpression, FunctionCall, AggregateFunction, SortOrder, OpaqueExpression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns the direct sub-expressions of this expression.
     *
     * @return an unmodifiable list of children, empty for leaves
     */
    List<Expression> children();

    /**
     * Dispatches to the visitor method for this expression kind.
     *
     * @param visitor the visitor
     * @param <R> the visitor result type
     * @return the visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
