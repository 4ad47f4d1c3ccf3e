package com.shardsql.generator;

import com.shardsql.exception.UnsupportedExpressionException;
import com.shardsql.expression.Literal;
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
import java.time.format.DateTimeFormatter;

/**
 * Utilities for quoting SQL identifiers and formatting literals in the remote
 * engine's MySQL-compatible dialect.
 *
 * <p>Every identifier is quoted, whether it needs it or not: generated names are
 * safe, but remote table and column names are arbitrary.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifier("order");
 *   // Result: `order`
 *
 *   String value = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O\'Reilly'
 * </pre>
 *
 * @see SQLBuilder
 */
public final class SQLQuoting {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses backticks and escapes internal backticks by doubling them.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Quotes a database-qualified table name.
     *
     * @param database the database name
     * @param table the table name
     * @return {@code `database`.`table`}
     */
    public static String quoteTableName(String database, String table) {
        return quoteIdentifier(database) + "." + quoteIdentifier(table);
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes. Backslash is an escape character in the remote
     * dialect, so backslashes are escaped before quotes. Control characters that
     * the remote parser would otherwise interpret are escaped too.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }

        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '\0':
                    sb.append("\\0");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\u001A':
                    sb.append("\\Z");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('\'');
        return sb.toString();
    }

    /**
     * Formats a literal expression as SQL text.
     *
     * @param literal the literal
     * @return the SQL text
     * @throws UnsupportedExpressionException if the value has no exact spelling in the remote dialect
     */
    public static String formatLiteral(Literal literal) {
        Object value = literal.value();
        DataType dataType = literal.dataType();

        if (value == null) {
            return "NULL";
        }

        if (dataType instanceof StringType) {
            return quoteLiteral(value.toString());
        }

        if (dataType instanceof BooleanType && value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }

        if ((dataType instanceof IntegerType || dataType instanceof LongType)
                && (value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte)) {
            return value.toString();
        }

        if (dataType instanceof DoubleType && value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new UnsupportedExpressionException("Non-finite double has no SQL literal", literal);
            }
            // Double.toString keeps every significant digit, so the value reads back unchanged
            return Double.toString(d);
        }

        if (dataType instanceof DecimalType && value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }

        if (dataType instanceof DateType && value instanceof LocalDate) {
            return "DATE '" + value + "'";
        }

        if (dataType instanceof TimestampType && value instanceof LocalDateTime) {
            return "TIMESTAMP '" + TIMESTAMP_FORMAT.format((LocalDateTime) value) + "'";
        }

        throw new UnsupportedExpressionException(
            "Literal of type " + dataType + " with value class " + value.getClass().getSimpleName(), literal);
    }
}
