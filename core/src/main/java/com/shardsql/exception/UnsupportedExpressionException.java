package com.shardsql.exception;

import com.shardsql.expression.Expression;

/**
 * Thrown by the SQL builder when an expression cannot be rendered against the
 * columns in scope.
 *
 * <p>Common causes:
 * <ul>
 *   <li>An expression kind with no SQL spelling (user-defined or window functions)</li>
 *   <li>A function with no counterpart on the remote engine</li>
 *   <li>A column reference that is not produced by any child in scope</li>
 *   <li>A literal value the remote dialect cannot represent (NaN, infinity)</li>
 * </ul>
 *
 * <p>The plan translator catches it and refuses to push down the node being
 * translated.
 */
public class UnsupportedExpressionException extends PushdownException {

    private final transient Expression expression;

    /**
     * Creates an unsupported expression exception.
     *
     * @param message the reason
     * @param expression the expression that could not be rendered
     */
    public UnsupportedExpressionException(String message, Expression expression) {
        super(message + ": " + expression);
        this.expression = expression;
    }

    /**
     * Returns the expression that could not be rendered.
     *
     * @return the expression
     */
    public Expression getExpression() {
        return expression;
    }
}
