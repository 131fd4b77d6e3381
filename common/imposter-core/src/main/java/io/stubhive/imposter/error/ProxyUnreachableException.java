package io.stubhive.imposter.error;

/**
 * Raised by a proxy client when the origin cannot be contacted or does not
 * answer in time. The resolver turns it into an error response; it never
 * escapes an imposter.
 */
public class ProxyUnreachableException extends ImposterException {

    public ProxyUnreachableException(String message, Throwable cause) {
        super("invalid proxy", message, cause);
    }

    public ProxyUnreachableException(String message) {
        super("invalid proxy", message);
    }
}
