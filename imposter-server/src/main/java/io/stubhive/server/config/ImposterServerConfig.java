package io.stubhive.server.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.stubhive.imposter.metrics.ImposterMetrics;
import io.stubhive.imposter.protocol.AdapterSettings;
import io.stubhive.imposter.registry.ImposterRegistry;
import io.stubhive.imposter.registry.RegistrySettings;
import io.stubhive.imposter.response.DisabledResponseInjector;
import io.stubhive.imposter.response.ResponseInjector;
import io.stubhive.imposter.snapshot.SnapshotStore;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(StubHiveProperties.class)
public class ImposterServerConfig {

    @Bean
    ImposterMetrics imposterMetrics(MeterRegistry meterRegistry) {
        return new ImposterMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    ResponseInjector responseInjector() {
        return DisabledResponseInjector.INSTANCE;
    }

    @Bean(destroyMethod = "close")
    ImposterRegistry imposterRegistry(StubHiveProperties properties, ImposterMetrics metrics, ResponseInjector injector) {
        AdapterSettings adapter = new AdapterSettings(
            properties.getConnection().getMaxConnections(),
            properties.getConnection().getIdleTimeout(),
            properties.getShutdownGrace(),
            properties.getMaxMessageBytes());
        RegistrySettings settings = new RegistrySettings(
            properties.isAllowInjection(),
            properties.getHost(),
            properties.getProxyTimeout(),
            adapter);
        return new ImposterRegistry(settings, metrics, injector);
    }

    /**
     * Binds the management API to {@code stubhive.host} when one is set.
     */
    @Bean
    WebServerFactoryCustomizer<ConfigurableWebServerFactory> managementAddressCustomizer(StubHiveProperties properties) {
        return factory -> {
            String host = properties.getHost();
            if (!StringUtils.hasText(host)) {
                return;
            }
            try {
                factory.setAddress(InetAddress.getByName(host));
            } catch (UnknownHostException ex) {
                throw new IllegalStateException("Cannot resolve stubhive.host " + host, ex);
            }
        };
    }

    @Bean
    SnapshotStore snapshotStore(ImposterRegistry registry) {
        return new SnapshotStore(registry);
    }
}
