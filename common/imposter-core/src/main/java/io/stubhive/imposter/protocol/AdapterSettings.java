package io.stubhive.imposter.protocol;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection handling shared by every adapter.
 *
 * @param maxConnections  concurrent connections per imposter, {@code 0} for no limit
 * @param idleTimeout     idle connections are closed after this long, zero disables
 * @param shutdownGrace   how long stop waits for in-flight requests
 * @param maxMessageBytes largest request accepted on any protocol
 */
public record AdapterSettings(int maxConnections, Duration idleTimeout, Duration shutdownGrace, int maxMessageBytes) {

    public static final AdapterSettings DEFAULTS =
        new AdapterSettings(0, Duration.ZERO, Duration.ofSeconds(5), 10 * 1024 * 1024);

    public AdapterSettings {
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must not be negative");
        }
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("maxMessageBytes must be positive");
        }
    }
}
