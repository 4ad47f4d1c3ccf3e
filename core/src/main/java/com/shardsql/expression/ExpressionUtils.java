package com.shardsql.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers over expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns whether an expression tree contains an aggregate function.
     *
     * @param expression the root expression
     * @return true if any node is an {@link AggregateFunction}
     */
    public static boolean containsAggregate(Expression expression) {
        if (expression instanceof AggregateFunction) {
            return true;
        }
        for (Expression child : expression.children()) {
            if (containsAggregate(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Converts a list of named expressions to the attributes they produce.
     *
     * @param expressions the named expressions
     * @return their output attributes in order
     */
    public static List<AttributeReference> toAttributes(List<? extends NamedExpression> expressions) {
        List<AttributeReference> result = new ArrayList<>(expressions.size());
        for (NamedExpression expression : expressions) {
            result.add(expression.toAttribute());
        }
        return result;
    }
}
