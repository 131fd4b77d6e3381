package io.stubhive.server.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.server.config.StubHiveProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Builds {@code _links} for API documents. The configured host replaces the
 * request's host so that links point at the address imposters are bound to.
 */
@Component
public class ApiLinks {
    private final StubHiveProperties properties;

    public ApiLinks(StubHiveProperties properties) {
        this.properties = properties;
    }

    public String base() {
        ServletUriComponentsBuilder builder = ServletUriComponentsBuilder.fromCurrentContextPath();
        String host = properties.getHost();
        if (host != null && !host.isBlank() && !"0.0.0.0".equals(host) && !"::".equals(host)) {
            builder.host(host);
        }
        return builder.toUriString();
    }

    public String imposter(int port) {
        return base() + "/imposters/" + port;
    }

    public ObjectNode imposterLinks(int port) {
        ObjectNode links = ImposterJson.objectNode();
        String self = imposter(port);
        links.putObject("self").put("href", self);
        links.putObject("stubs").put("href", self + "/stubs");
        return links;
    }

    public ObjectNode homeLinks() {
        String base = base();
        ObjectNode links = ImposterJson.objectNode();
        links.putObject("imposters").put("href", base + "/imposters");
        links.putObject("snapshot").put("href", base + "/snapshot");
        links.putObject("config").put("href", base + "/config");
        return links;
    }
}
