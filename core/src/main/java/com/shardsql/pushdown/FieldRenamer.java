package com.shardsql.pushdown;

import com.shardsql.expression.Alias;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.NamedExpression;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-aliases SELECT-list expressions to fresh synthetic names.
 *
 * <p>Every output column of a generated SELECT list is aliased exactly once:
 * <pre>
 *   name            -&gt;  `q`.`name` AS `f_0`
 *   price * 2 AS p  -&gt;  (`q`.`price` * 2) AS `f_1`
 * </pre>
 * An existing alias is unwrapped first since {@code x AS y AS z} is not valid
 * SQL. The expression id is kept, so parents keep resolving the column, and
 * the host-facing name goes to the {@link CompilationContext} instead of the
 * SQL text.
 */
public final class FieldRenamer {

    private FieldRenamer() {}

    /**
     * Renames a list of named expressions.
     *
     * @param expressions the SELECT list
     * @param context the compilation context supplying names
     * @return one alias per expression, in order
     */
    public static List<Alias> rename(List<? extends NamedExpression> expressions, CompilationContext context) {
        List<Alias> renamed = new ArrayList<>(expressions.size());
        for (NamedExpression expression : expressions) {
            renamed.add(rename(expression, context));
        }
        return renamed;
    }

    /**
     * Renames one named expression.
     *
     * @param expression the expression
     * @param context the compilation context supplying names
     * @return the expression aliased to a fresh field name
     */
    public static Alias rename(NamedExpression expression, CompilationContext context) {
        String fieldName = context.nextFieldName();
        if (expression instanceof Alias) {
            Alias alias = (Alias) expression;
            context.recordDisplayName(alias.exprId(), alias.name());
            return new Alias(alias.child(), fieldName, alias.exprId());
        }
        AttributeReference attribute = (AttributeReference) expression;
        // A column renamed lower in the tree keeps the name recorded there
        context.recordDisplayName(attribute.exprId(), context.displayNameOf(attribute));
        return new Alias(attribute, fieldName, attribute.exprId());
    }
}
