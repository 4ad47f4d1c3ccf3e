package com.shardsql.types;

public final class DateType extends PrimitiveType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {
        super("date");
    }

    public static DateType get() {
        return INSTANCE;
    }
}
