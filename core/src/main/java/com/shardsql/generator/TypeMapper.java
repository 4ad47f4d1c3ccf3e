package com.shardsql.generator;

import com.shardsql.types.DataType;
import com.shardsql.types.DateType;
import com.shardsql.types.DecimalType;
import com.shardsql.types.DoubleType;
import com.shardsql.types.IntegerType;
import com.shardsql.types.LongType;
import com.shardsql.types.StringType;
import com.shardsql.types.TimestampType;
import java.util.Optional;

/**
 * Maps host data types to the type names accepted by the remote engine's
 * {@code CAST(... AS type)}.
 *
 * <p>The remote cast grammar is narrower than its column types:
 * <pre>
 *   IntegerType, LongType → SIGNED
 *   DoubleType            → DOUBLE
 *   DecimalType(10, 2)    → DECIMAL(10,2)
 *   StringType            → CHAR
 *   DateType              → DATE
 *   TimestampType         → DATETIME(6)
 * </pre>
 * There is no cast to a boolean, so casts to {@code BooleanType} are not pushed down.
 */
public final class TypeMapper {

    private TypeMapper() {}

    /**
     * Returns the cast target for a host type.
     *
     * @param dataType the host type
     * @return the remote cast type, or empty if the remote engine cannot cast to it
     */
    public static Optional<String> toCastType(DataType dataType) {
        if (dataType == null) {
            throw new IllegalArgumentException("dataType must not be null");
        }
        if (dataType instanceof IntegerType || dataType instanceof LongType) {
            return Optional.of("SIGNED");
        }
        if (dataType instanceof DoubleType) {
            return Optional.of("DOUBLE");
        }
        if (dataType instanceof DecimalType) {
            DecimalType d = (DecimalType) dataType;
            return Optional.of(String.format("DECIMAL(%d,%d)", d.precision(), d.scale()));
        }
        if (dataType instanceof StringType) {
            return Optional.of("CHAR");
        }
        if (dataType instanceof DateType) {
            return Optional.of("DATE");
        }
        if (dataType instanceof TimestampType) {
            return Optional.of("DATETIME(6)");
        }
        return Optional.empty();
    }
}
