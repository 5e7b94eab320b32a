package io.stackcontroller.lease;

/**
 * Exception thrown when a lease operation cannot reach its store.
 */
public class LeaseException extends Exception {

    public LeaseException(String message) {
        super(message);
    }

    public LeaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
