package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a reference to a column produced by a child plan.
 *
 * <p>A reference is resolved by its {@link ExprId}, never by its name. The name
 * is only what the host called the column; the SQL rendered for the reference
 * uses whatever field name the child query assigned to that id.
 */
public final class AttributeReference implements NamedExpression {

    private final String name;
    private final DataType dataType;
    private final boolean nullable;
    private final ExprId exprId;

    /**
     * Creates an attribute reference.
     *
     * @param name the column name
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     * @param exprId the stable id of the column
     */
    public AttributeReference(String name, DataType dataType, boolean nullable, ExprId exprId) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
        this.exprId = Objects.requireNonNull(exprId, "exprId must not be null");
    }

    /**
     * Creates a nullable attribute with a freshly allocated id.
     *
     * @param name the column name
     * @param dataType the data type
     * @return the attribute
     */
    public static AttributeReference of(String name, DataType dataType) {
        return new AttributeReference(name, dataType, true, ExprId.next());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExprId exprId() {
        return exprId;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public AttributeReference toAttribute() {
        return this;
    }

    /**
     * Returns a copy of this attribute under another name, keeping its id.
     *
     * @param newName the new name
     * @return the renamed attribute
     */
    public AttributeReference withName(String newName) {
        return new AttributeReference(newName, dataType, nullable, exprId);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttributeReference(this);
    }

    @Override
    public String toString() {
        return name + exprId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeReference)) return false;
        AttributeReference that = (AttributeReference) obj;
        return nullable == that.nullable &&
               Objects.equals(name, that.name) &&
               Objects.equals(dataType, that.dataType) &&
               Objects.equals(exprId, that.exprId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, nullable, exprId);
    }
}
