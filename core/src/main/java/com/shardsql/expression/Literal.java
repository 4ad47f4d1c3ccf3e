package com.shardsql.expression;

import com.shardsql.types.BooleanType;
import com.shardsql.types.DataType;
import com.shardsql.types.DateType;
import com.shardsql.types.DecimalType;
import com.shardsql.types.DoubleType;
import com.shardsql.types.IntegerType;
import com.shardsql.types.LongType;
import com.shardsql.types.StringType;
import com.shardsql.types.TimestampType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 3.14, 100L</li>
 *   <li>String literals: 'hello'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Null literal: null</li>
 *   <li>Temporal literals: DATE '2024-01-15'</li>
 * </ul>
 *
 * <p>The SQL text of a literal is produced by
 * {@link com.shardsql.generator.SQLQuoting#formatLiteral(Literal)}.
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    /**
     * Returns whether this is a NULL literal.
     *
     * @return true if value is null, false otherwise
     */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates a decimal literal whose type matches the value's precision and scale.
     *
     * @param value the decimal value
     * @return the literal expression
     */
    public static Literal of(BigDecimal value) {
        int precision = Math.max(value.precision(), Math.max(value.scale(), 1));
        return new Literal(value, new DecimalType(precision, Math.max(value.scale(), 0)));
    }

    public static Literal of(LocalDate value) {
        return new Literal(value, DateType.get());
    }

    public static Literal of(LocalDateTime value) {
        return new Literal(value, TimestampType.get());
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
