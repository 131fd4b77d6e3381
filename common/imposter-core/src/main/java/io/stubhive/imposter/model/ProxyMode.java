package io.stubhive.imposter.model;

import io.stubhive.imposter.error.InvalidImposterException;

public enum ProxyMode {
    /** Record the first origin response and replace the proxy entry with it. */
    PROXY_ONCE("proxyOnce"),
    /** Always forward; keep every origin response as a recorded entry. */
    PROXY_ALWAYS("proxyAlways"),
    /** Always forward; record nothing. */
    PROXY_TRANSPARENT("proxyTransparent");

    private final String wireValue;

    ProxyMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static ProxyMode fromWireValue(String value) {
        if (value == null) {
            return PROXY_ONCE;
        }
        for (ProxyMode mode : values()) {
            if (mode.wireValue.equals(value)) {
                return mode;
            }
        }
        throw new InvalidImposterException("invalid proxy mode: " + value);
    }
}
