package com.shardsql.types;

/**
 * Sealed interface for the scalar data types the host attaches to columns and
 * expressions.
 *
 * <p>Only types that have a direct counterpart in the remote engine's SQL
 * dialect are modeled. Columns of any other host type are described to the
 * compiler as opaque expressions and are never pushed down.
 */
public sealed interface DataType
    permits PrimitiveType, DecimalType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether values of this type are whole numbers.
     *
     * @return true for integral types
     */
    default boolean isIntegral() {
        return false;
    }
}
