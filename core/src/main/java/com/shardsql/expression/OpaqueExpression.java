package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A host expression with no SQL rendering, such as a user-defined function, a
 * window function or a subquery expression.
 *
 * <p>Its children are still exposed so reference analysis sees through it, but
 * any plan node that has to render one is not pushed down.
 */
public final class OpaqueExpression implements Expression {

    private final String description;
    private final DataType dataType;
    private final List<Expression> children;

    public OpaqueExpression(String description, DataType dataType, List<Expression> children) {
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children must not be null"));
    }

    public OpaqueExpression(String description, DataType dataType) {
        this(description, dataType, Collections.emptyList());
    }

    public String description() {
        return description;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOpaque(this);
    }

    @Override
    public String toString() {
        return "opaque:" + description + children;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OpaqueExpression)) return false;
        OpaqueExpression that = (OpaqueExpression) obj;
        return Objects.equals(description, that.description) &&
               Objects.equals(dataType, that.dataType) &&
               Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, dataType, children);
    }
}
