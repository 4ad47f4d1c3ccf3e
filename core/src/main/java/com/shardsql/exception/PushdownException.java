package com.shardsql.exception;

/**
 * Base class for failures raised inside the pushdown compiler.
 *
 * <p>None of these ever reach the host: the compiler turns every one of them
 * into "not pushable" and the host executes the plan itself.
 */
public abstract class PushdownException extends RuntimeException {

    protected PushdownException(String message) {
        super(message);
    }

    protected PushdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
