package io.stackcontroller.broker;

/**
 * A broker endpoint operation could not be completed.
 */
public class BrokerException extends Exception {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
