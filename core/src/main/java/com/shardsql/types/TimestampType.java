package com.shardsql.types;

/**
 * Local date-time with microsecond precision, cast remotely as
 * {@code DATETIME(6)}.
 */
public final class TimestampType extends PrimitiveType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {
        super("timestamp");
    }

    public static TimestampType get() {
        return INSTANCE;
    }
}
