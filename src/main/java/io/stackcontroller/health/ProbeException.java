package io.stackcontroller.health;

/**
 * A single health probe did not pass.
 */
public class ProbeException extends Exception {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
