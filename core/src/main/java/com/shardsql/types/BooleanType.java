package com.shardsql.types;

/**
 * Truth values. Literals render as {@code TRUE}/{@code FALSE}; the remote
 * engine has no boolean cast target, so a cast to this type is not pushed down.
 */
public final class BooleanType extends PrimitiveType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {
        super("boolean");
    }

    public static BooleanType get() {
        return INSTANCE;
    }
}
