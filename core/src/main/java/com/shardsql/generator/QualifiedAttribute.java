package com.shardsql.generator;

import com.shardsql.expression.AttributeReference;
import java.util.Objects;

/**
 * A column in scope for SQL rendering: an attribute together with the alias of
 * the subquery that produces it.
 *
 * @param qualifier the producing subquery's alias
 * @param attribute the attribute, named as that subquery names it
 */
public record QualifiedAttribute(String qualifier, AttributeReference attribute) {

    public QualifiedAttribute {
        Objects.requireNonNull(qualifier, "qualifier must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
    }

    /**
     * Returns the SQL text that references this column from the enclosing query.
     *
     * @return {@code `qualifier`.`name`}
     */
    public String toSQL() {
        return SQLQuoting.quoteIdentifier(qualifier) + "." + SQLQuoting.quoteIdentifier(attribute.name());
    }

    @Override
    public String toString() {
        return qualifier + "." + attribute;
    }
}
