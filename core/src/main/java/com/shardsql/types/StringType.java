package com.shardsql.types;

/**
 * Character string. Comparison semantics follow the remote column's collation.
 */
public final class StringType extends PrimitiveType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {
        super("string");
    }

    public static StringType get() {
        return INSTANCE;
    }
}
