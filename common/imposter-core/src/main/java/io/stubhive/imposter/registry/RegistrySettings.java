package io.stubhive.imposter.registry;

import io.stubhive.imposter.protocol.AdapterSettings;
import java.time.Duration;
import java.util.Objects;

/**
 * @param allowInjection accept imposters with {@code inject} responses
 * @param defaultHost    bind address used when an imposter names none, {@code null} for every interface
 * @param proxyTimeout   connect and reply limit for proxy calls
 * @param adapter        connection handling for the protocol adapters
 */
public record RegistrySettings(boolean allowInjection, String defaultHost, Duration proxyTimeout, AdapterSettings adapter) {

    public static final RegistrySettings DEFAULTS =
        new RegistrySettings(false, null, Duration.ofSeconds(10), AdapterSettings.DEFAULTS);

    public RegistrySettings {
        Objects.requireNonNull(proxyTimeout, "proxyTimeout");
        Objects.requireNonNull(adapter, "adapter");
        if (defaultHost != null && defaultHost.isBlank()) {
            defaultHost = null;
        }
    }

    public RegistrySettings withAllowInjection(boolean allow) {
        return new RegistrySettings(allow, defaultHost, proxyTimeout, adapter);
    }

    public RegistrySettings withProxyTimeout(Duration timeout) {
        return new RegistrySettings(allowInjection, defaultHost, timeout, adapter);
    }
}
