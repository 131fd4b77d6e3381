package io.stubhive.imposter.model;

/**
 * TCP-only imposter settings. Both fields stay {@code null} when not declared so
 * that documents round-trip unchanged.
 */
public record TcpOptions(TcpMode mode, TcpFraming framing) {

    public static final TcpOptions DEFAULTS = new TcpOptions(null, null);

    public TcpMode effectiveMode() {
        return mode == null ? TcpMode.TEXT : mode;
    }

    public TcpFraming effectiveFraming() {
        return framing == null ? TcpFraming.chunk() : framing;
    }
}
