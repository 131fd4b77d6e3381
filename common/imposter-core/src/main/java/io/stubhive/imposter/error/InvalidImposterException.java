package io.stubhive.imposter.error;

/**
 * Raised when an imposter, stub, predicate or response definition is not valid.
 */
public class InvalidImposterException extends ImposterException {

    public InvalidImposterException(String message) {
        super("bad data", message);
    }

    public InvalidImposterException(String message, Throwable cause) {
        super("bad data", message, cause);
    }
}
