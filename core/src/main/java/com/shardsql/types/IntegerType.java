package com.shardsql.types;

/**
 * 32-bit signed integer.
 */
public final class IntegerType extends PrimitiveType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {
        super("integer");
    }

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }
}
