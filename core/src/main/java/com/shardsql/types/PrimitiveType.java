package com.shardsql.types;

/**
 * Base of the parameterless types.
 *
 * <p>Each subclass has exactly one instance, reached through its static
 * {@code get()}, so two primitive types are equal exactly when they are of the
 * same class.
 */
public abstract sealed class PrimitiveType implements DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType, DateType, TimestampType {

    private final String typeName;

    PrimitiveType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public final String typeName() {
        return typeName;
    }

    @Override
    public final boolean equals(Object obj) {
        return obj != null && obj.getClass() == getClass();
    }

    @Override
    public final int hashCode() {
        return typeName.hashCode();
    }

    @Override
    public final String toString() {
        return typeName;
    }
}
