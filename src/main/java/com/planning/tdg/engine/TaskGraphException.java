package com.planning.tdg.engine;

/**
 * Base class for every failure raised by {@link TaskGraph} operations.
 *
 * All subclasses are unchecked. A mutation that throws one of them leaves the
 * graph exactly as it was before the call.
 */
public class TaskGraphException extends RuntimeException {

    public TaskGraphException(String message) {
        super(message);
    }

    public TaskGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
