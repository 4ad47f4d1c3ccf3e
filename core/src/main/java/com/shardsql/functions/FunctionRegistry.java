package com.shardsql.functions;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of host scalar functions mapped to the remote engine's SQL functions.
 *
 * <p>Most functions have a direct 1:1 mapping and only change spelling. A few
 * need custom translation logic because the remote engine orders arguments
 * differently or has no function of the same meaning.
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: upper, lower, trim, substring, concat, etc.</li>
 *   <li>Math functions: abs, ceil, floor, round, sqrt, pow, etc.</li>
 *   <li>Date/time functions: year, month, day, datediff, etc.</li>
 *   <li>Conditional functions: coalesce, if, nullif, etc.</li>
 * </ul>
 *
 * <p>Aggregate functions are not here; they are a separate expression kind.
 *
 * @see FunctionTranslator
 */
public final class FunctionRegistry {

    private static final Map<String, String> DIRECT_MAPPINGS = new HashMap<>();
    private static final Map<String, FunctionTranslator> CUSTOM_TRANSLATORS = new HashMap<>();
    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d{1,18}");

    static {
        initializeStringFunctions();
        initializeMathFunctions();
        initializeDateFunctions();
        initializeConditionalFunctions();
    }

    private FunctionRegistry() {}

    /**
     * Translates a host function call to remote SQL.
     *
     * @param functionName the host function name
     * @param args the function arguments (as SQL strings)
     * @return the translated SQL function call, or empty if the function is not supported
     */
    public static Optional<String> translate(String functionName, String... args) {
        if (functionName == null || functionName.isEmpty()) {
            throw new IllegalArgumentException("functionName must not be null or empty");
        }

        String normalizedName = functionName.toLowerCase();

        String remoteFunction = DIRECT_MAPPINGS.get(normalizedName);
        if (remoteFunction != null) {
            return Optional.of(buildFunctionCall(remoteFunction, args));
        }

        FunctionTranslator translator = CUSTOM_TRANSLATORS.get(normalizedName);
        if (translator != null) {
            return translator.translate(args);
        }

        return Optional.empty();
    }

    /**
     * Checks if a function is supported.
     *
     * @param functionName the function name
     * @return true if supported, false otherwise
     */
    public static boolean isSupported(String functionName) {
        if (functionName == null || functionName.isEmpty()) {
            return false;
        }
        String normalizedName = functionName.toLowerCase();
        return DIRECT_MAPPINGS.containsKey(normalizedName) ||
               CUSTOM_TRANSLATORS.containsKey(normalizedName);
    }

    private static String buildFunctionCall(String functionName, String... args) {
        if (args.length == 0) {
            return functionName + "()";
        }
        return functionName + "(" + String.join(", ", args) + ")";
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions() {
        DIRECT_MAPPINGS.put("upper", "UPPER");
        DIRECT_MAPPINGS.put("lower", "LOWER");
        DIRECT_MAPPINGS.put("ucase", "UPPER");
        DIRECT_MAPPINGS.put("lcase", "LOWER");

        DIRECT_MAPPINGS.put("trim", "TRIM");
        DIRECT_MAPPINGS.put("ltrim", "LTRIM");
        DIRECT_MAPPINGS.put("rtrim", "RTRIM");

        DIRECT_MAPPINGS.put("concat", "CONCAT");
        DIRECT_MAPPINGS.put("concat_ws", "CONCAT_WS");
        CUSTOM_TRANSLATORS.put("substring", FunctionRegistry::translateSubstring);
        CUSTOM_TRANSLATORS.put("substr", FunctionRegistry::translateSubstring);
        DIRECT_MAPPINGS.put("replace", "REPLACE");
        DIRECT_MAPPINGS.put("reverse", "REVERSE");
        DIRECT_MAPPINGS.put("lpad", "LPAD");
        DIRECT_MAPPINGS.put("rpad", "RPAD");
        DIRECT_MAPPINGS.put("repeat", "REPEAT");

        // Host length counts characters; remote LENGTH counts bytes
        DIRECT_MAPPINGS.put("length", "CHAR_LENGTH");
        DIRECT_MAPPINGS.put("char_length", "CHAR_LENGTH");
        DIRECT_MAPPINGS.put("character_length", "CHAR_LENGTH");

        // instr(str, substr) has the same argument order on both sides
        DIRECT_MAPPINGS.put("instr", "INSTR");

        // locate(substr, str[, pos]) likewise
        DIRECT_MAPPINGS.put("locate", "LOCATE");
    }

    /**
     * Host substring treats position 0 as 1; remote SUBSTRING returns an empty
     * string for it. Negative positions count from the end on both sides.
     */
    private static Optional<String> translateSubstring(String... args) {
        if (args.length != 2 && args.length != 3) {
            return Optional.empty();
        }
        String position = args[1];
        if (INTEGER_LITERAL.matcher(position).matches()) {
            if (Long.parseLong(position) == 0) {
                position = "1";
            }
        } else {
            position = "IF(" + position + " = 0, 1, " + position + ")";
        }
        if (args.length == 2) {
            return Optional.of("SUBSTRING(" + args[0] + ", " + position + ")");
        }
        return Optional.of("SUBSTRING(" + args[0] + ", " + position + ", " + args[2] + ")");
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        DIRECT_MAPPINGS.put("abs", "ABS");
        DIRECT_MAPPINGS.put("ceil", "CEIL");
        DIRECT_MAPPINGS.put("ceiling", "CEIL");
        DIRECT_MAPPINGS.put("floor", "FLOOR");
        DIRECT_MAPPINGS.put("sqrt", "SQRT");
        DIRECT_MAPPINGS.put("exp", "EXP");
        DIRECT_MAPPINGS.put("ln", "LN");
        DIRECT_MAPPINGS.put("log10", "LOG10");
        DIRECT_MAPPINGS.put("log2", "LOG2");
        DIRECT_MAPPINGS.put("pow", "POW");
        DIRECT_MAPPINGS.put("power", "POW");
        DIRECT_MAPPINGS.put("sign", "SIGN");
        DIRECT_MAPPINGS.put("signum", "SIGN");
        DIRECT_MAPPINGS.put("greatest", "GREATEST");
        DIRECT_MAPPINGS.put("least", "LEAST");

        // round(x) and round(x, d) both exist remotely; the host's default scale is 0
        CUSTOM_TRANSLATORS.put("round", args -> {
            if (args.length == 1) {
                return Optional.of("ROUND(" + args[0] + ", 0)");
            }
            if (args.length == 2) {
                return Optional.of("ROUND(" + args[0] + ", " + args[1] + ")");
            }
            return Optional.empty();
        });
    }

    // ==================== Date/Time Functions ====================

    private static void initializeDateFunctions() {
        DIRECT_MAPPINGS.put("year", "YEAR");
        DIRECT_MAPPINGS.put("quarter", "QUARTER");
        DIRECT_MAPPINGS.put("month", "MONTH");
        DIRECT_MAPPINGS.put("dayofmonth", "DAYOFMONTH");
        DIRECT_MAPPINGS.put("day", "DAYOFMONTH");
        DIRECT_MAPPINGS.put("dayofweek", "DAYOFWEEK");
        DIRECT_MAPPINGS.put("dayofyear", "DAYOFYEAR");
        DIRECT_MAPPINGS.put("hour", "HOUR");
        DIRECT_MAPPINGS.put("minute", "MINUTE");
        DIRECT_MAPPINGS.put("second", "SECOND");
        DIRECT_MAPPINGS.put("to_date", "DATE");
        DIRECT_MAPPINGS.put("last_day", "LAST_DAY");

        // datediff(end, start) has the same argument order on both sides
        DIRECT_MAPPINGS.put("datediff", "DATEDIFF");

        CUSTOM_TRANSLATORS.put("date_add", args -> args.length == 2
            ? Optional.of("DATE_ADD(" + args[0] + ", INTERVAL " + args[1] + " DAY)")
            : Optional.empty());
        CUSTOM_TRANSLATORS.put("date_sub", args -> args.length == 2
            ? Optional.of("DATE_SUB(" + args[0] + ", INTERVAL " + args[1] + " DAY)")
            : Optional.empty());
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions() {
        DIRECT_MAPPINGS.put("coalesce", "COALESCE");
        DIRECT_MAPPINGS.put("nullif", "NULLIF");
        DIRECT_MAPPINGS.put("ifnull", "IFNULL");
        DIRECT_MAPPINGS.put("nvl", "IFNULL");

        CUSTOM_TRANSLATORS.put("if", args -> args.length == 3
            ? Optional.of("IF(" + args[0] + ", " + args[1] + ", " + args[2] + ")")
            : Optional.empty());
    }

    /**
     * Translates the already-rendered arguments of one function.
     */
    @FunctionalInterface
    public interface FunctionTranslator {

        /**
         * Builds the remote call.
         *
         * @param args the rendered arguments
         * @return the SQL text, or empty if the arity is not supported
         */
        Optional<String> translate(String... args);
    }
}
