package io.stubhive.imposter.error;

/**
 * Base type for every failure reported by the imposter engine.
 * <p>
 * Each subtype carries a stable wire {@link #code()} which the management API
 * echoes in its {@code errors} payload.
 */
public abstract class ImposterException extends RuntimeException {

    private final String code;

    protected ImposterException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected ImposterException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
