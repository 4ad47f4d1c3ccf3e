package com.shardsql.pushdown;

import com.shardsql.expression.AttributeReference;
import java.util.Objects;

/**
 * One column of a compiled query's result, mapping the remote column label back
 * to the host's attribute.
 *
 * @param attribute the host attribute this column carries
 * @param fieldName the column label in the generated SQL
 * @param displayName the name the host expects for the column
 */
public record OutputColumn(AttributeReference attribute, String fieldName, String displayName) {

    public OutputColumn {
        Objects.requireNonNull(attribute, "attribute must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
    }
}
