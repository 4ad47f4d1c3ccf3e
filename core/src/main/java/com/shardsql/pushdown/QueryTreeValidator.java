package com.shardsql.pushdown;

import com.shardsql.exception.SQLGenerationException;
import com.shardsql.expression.AttributeReference;
import com.shardsql.logical.LogicalPlan;
import com.shardsql.pushdown.query.AbstractQuery;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants of a translated query tree.
 */
final class QueryTreeValidator {

    private QueryTreeValidator() {}

    /**
     * Validates a tree against the plan it was translated from.
     *
     * @throws SQLGenerationException if an alias repeats, a subquery produces
     *         two columns of the same name, or the root output differs from the
     *         plan output
     */
    static void validate(AbstractQuery tree, LogicalPlan plan) {
        checkNode(tree, new HashSet<>(), plan);

        List<AttributeReference> expected = plan.output();
        List<AttributeReference> actual = tree.output();
        if (expected.size() != actual.size()) {
            throw new SQLGenerationException(String.format(
                "Query produces %d columns, plan expects %d", actual.size(), expected.size()), plan);
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).exprId().equals(actual.get(i).exprId())) {
                throw new SQLGenerationException(String.format(
                    "Column %d is %s, plan expects %s", i, actual.get(i), expected.get(i)), plan);
            }
        }
    }

    private static void checkNode(AbstractQuery node, Set<String> aliases, LogicalPlan plan) {
        if (!aliases.add(node.alias().toString())) {
            throw new SQLGenerationException("Duplicate subquery alias " + node.alias(), plan);
        }
        Set<String> names = new HashSet<>();
        for (AttributeReference attribute : node.output()) {
            if (!names.add(attribute.name())) {
                throw new SQLGenerationException(
                    "Subquery " + node.alias() + " produces column " + attribute.name() + " twice", plan);
            }
        }
        for (AbstractQuery child : node.children()) {
            checkNode(child, aliases, plan);
        }
    }
}
