package io.stubhive.server.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.server.config.StubHiveProperties;
import java.lang.management.ManagementFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);
    private final ApiLinks links;
    private final StubHiveProperties properties;
    private final String version;

    public HomeController(ApiLinks links, StubHiveProperties properties,
                          @Value("${stubhive.version:unknown}") String version) {
        this.links = links;
        this.properties = properties;
        this.version = version;
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode home() {
        log.info("[REST] GET /");
        ObjectNode home = ImposterJson.objectNode();
        home.set("_links", links.homeLinks());
        return home;
    }

    @GetMapping(value = "/config", produces = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode config() {
        log.info("[REST] GET /config");
        ObjectNode config = ImposterJson.objectNode();
        config.put("version", version);
        ObjectNode options = config.putObject("options");
        options.put("host", properties.getHost());
        options.put("allowInjection", properties.isAllowInjection());
        options.put("proxyTimeout", properties.getProxyTimeout().toString());
        options.put("shutdownGrace", properties.getShutdownGrace().toString());
        options.put("maxMessageBytes", properties.getMaxMessageBytes());
        options.put("maxConnections", properties.getConnection().getMaxConnections());
        options.put("idleTimeout", properties.getConnection().getIdleTimeout().toString());
        options.put("configFile", properties.getImposters().getConfigFile() == null
            ? null : properties.getImposters().getConfigFile().toString());
        options.put("snapshotFile", properties.getSnapshot().getFile().toString());
        ObjectNode process = config.putObject("process");
        process.put("javaVersion", System.getProperty("java.version"));
        process.put("uptimeMillis", ManagementFactory.getRuntimeMXBean().getUptime());
        process.put("availableProcessors", Runtime.getRuntime().availableProcessors());
        return config;
    }
}
