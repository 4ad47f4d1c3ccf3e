package com.shardsql.expression;

/**
 * An expression that carries a name and a stable {@link ExprId}, and can
 * therefore appear in a SELECT list and be referenced by a parent node.
 */
public sealed interface NamedExpression extends Expression
    permits AttributeReference, Alias {

    /**
     * Returns the output name of this expression.
     *
     * @return the name
     */
    String name();

    /**
     * Returns the identifier shared by this expression and every reference to its output.
     *
     * @return the expression id
     */
    ExprId exprId();

    /**
     * Returns the attribute a parent node uses to refer to this expression's output.
     *
     * @return the output attribute
     */
    AttributeReference toAttribute();
}
