package com.shardsql.types;

/**
 * IEEE 754 double. NaN and the infinities have no SQL literal and are never
 * pushed down.
 */
public final class DoubleType extends PrimitiveType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {
        super("double");
    }

    public static DoubleType get() {
        return INSTANCE;
    }
}
