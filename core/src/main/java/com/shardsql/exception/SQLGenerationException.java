package com.shardsql.exception;

import com.shardsql.logical.LogicalPlan;

/**
 * Exception thrown when an internal invariant of the pushdown compiler is
 * violated while translating a recognized plan shape.
 *
 * <p>This indicates a bug in the compiler rather than an unsupported query. It
 * carries the failed plan so the log line that absorbs it is useful.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       return translator.translate(plan, alias, context);
 *   } catch (SQLGenerationException e) {
 *       logger.warn(e.getTechnicalMessage());
 *       return Optional.empty();
 *   }
 * </pre>
 *
 * @see com.shardsql.pushdown.PushdownCompiler
 */
public class SQLGenerationException extends PushdownException {

    private final transient LogicalPlan failedPlan;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param plan the logical plan that failed to generate SQL
     */
    public SQLGenerationException(String message, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")");
        this.failedPlan = plan;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the logical plan that failed to generate SQL
     */
    public SQLGenerationException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")", cause);
        this.failedPlan = plan;
    }

    /**
     * Returns the logical plan that failed to generate SQL.
     *
     * @return the failed plan, or null if not available
     */
    public LogicalPlan getFailedPlan() {
        return failedPlan;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedPlan != null) {
            sb.append("Failed Plan Type: ").append(failedPlan.getClass().getName()).append("\n");
            sb.append("Plan:\n").append(failedPlan.treeString());
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
