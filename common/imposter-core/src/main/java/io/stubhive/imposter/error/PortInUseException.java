package io.stubhive.imposter.error;

/**
 * Raised when an imposter asks for a port that is already bound, either by
 * another imposter or by a foreign process.
 */
public class PortInUseException extends ImposterException {

    private final int port;

    public PortInUseException(int port) {
        super("resource conflict", "Port " + port + " is already in use");
        this.port = port;
    }

    public PortInUseException(int port, Throwable cause) {
        super("resource conflict", "Port " + port + " is already in use", cause);
        this.port = port;
    }

    public int port() {
        return port;
    }
}
