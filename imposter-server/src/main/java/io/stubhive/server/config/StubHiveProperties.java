package io.stubhive.server.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stubhive")
public class StubHiveProperties {
    /**
     * Bind address for imposters that do not name one. Empty binds every interface.
     */
    private String host;

    private boolean allowInjection;

    @NotNull
    private Duration proxyTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(5);

    @Min(1)
    private int maxMessageBytes = 10 * 1024 * 1024;

    private final Connection connection = new Connection();
    private final Imposters imposters = new Imposters();
    private final Snapshot snapshot = new Snapshot();

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public boolean isAllowInjection() {
        return allowInjection;
    }

    public void setAllowInjection(boolean allowInjection) {
        this.allowInjection = allowInjection;
    }

    public Duration getProxyTimeout() {
        return proxyTimeout;
    }

    public void setProxyTimeout(Duration proxyTimeout) {
        this.proxyTimeout = proxyTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public int getMaxMessageBytes() {
        return maxMessageBytes;
    }

    public void setMaxMessageBytes(int maxMessageBytes) {
        this.maxMessageBytes = maxMessageBytes;
    }

    public Connection getConnection() {
        return connection;
    }

    public Imposters getImposters() {
        return imposters;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public static class Connection {
        @Min(0)
        private int maxConnections;

        @NotNull
        private Duration idleTimeout = Duration.ZERO;

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }
    }

    public static class Imposters {
        /**
         * JSON or YAML document of imposters created once the application is ready.
         */
        private Path configFile;

        public Path getConfigFile() {
            return configFile;
        }

        public void setConfigFile(Path configFile) {
            this.configFile = configFile;
        }
    }

    public static class Snapshot {
        @NotNull
        private Path file = Path.of("mb.json");

        public Path getFile() {
            return file;
        }

        public void setFile(Path file) {
            this.file = file;
        }
    }
}
