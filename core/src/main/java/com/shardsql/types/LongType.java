package com.shardsql.types;

/**
 * 64-bit signed integer. Shares the {@code SIGNED} cast target with
 * {@link IntegerType}, but not its hash: a shard key declared as one never
 * matches a key declared as the other.
 */
public final class LongType extends PrimitiveType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {
        super("long");
    }

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }
}
