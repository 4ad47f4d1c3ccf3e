package com.shardsql.expression;

import com.shardsql.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a scalar function call.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)
 *   concat(first_name, ' ', last_name)
 *   abs(balance)
 * </pre>
 *
 * <p>The function name is the host's name. It is mapped to the remote engine's
 * spelling by {@link com.shardsql.functions.FunctionRegistry}; functions with no
 * mapping are not pushed down.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a function call expression.
     *
     * @param functionName the host function name
     * @param arguments the function arguments
     * @param dataType the return type
     * @param nullable whether the result can be null
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType, boolean nullable) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true);
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return nullable == that.nullable &&
               Objects.equals(functionName, that.functionName) &&
               Objects.equals(arguments, that.arguments) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType, nullable);
    }
}
