package io.stubhive.imposter.error;

/**
 * Raised when a listening socket cannot be bound, typically because the
 * requested host is not assignable on this machine.
 */
public class BindFailureException extends ImposterException {

    public BindFailureException(String message) {
        super("bind failure", message);
    }

    public BindFailureException(String message, Throwable cause) {
        super("bind failure", message, cause);
    }
}
