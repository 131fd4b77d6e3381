package io.stubhive.server.startup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stubhive.imposter.error.InvalidProtocolException;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.registry.Imposter;
import io.stubhive.imposter.registry.ImposterRegistry;
import io.stubhive.imposter.snapshot.SnapshotStore;
import io.stubhive.server.config.StubHiveProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImposterFileLoaderTest {

    @TempDir
    Path dir;

    private ImposterRegistry registry;
    private StubHiveProperties properties;
    private ImposterFileLoader loader;

    @BeforeEach
    void setUp() {
        registry = ImposterRegistry.withDefaults();
        properties = new StubHiveProperties();
        loader = new ImposterFileLoader(new SnapshotStore(registry), properties);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void loadsYamlImposters() throws Exception {
        Path file = Files.writeString(dir.resolve("imposters.yaml"), """
            imposters:
              - protocol: http
                host: 127.0.0.1
                name: from-yaml
                stubs:
                  - predicates:
                      - equals:
                          path: /health
                    responses:
                      - is:
                          statusCode: 200
                          body: up
              - protocol: tcp
                host: 127.0.0.1
            """);

        assertThat(loader.load(file)).isEqualTo(2);
        assertThat(registry.list()).extracting(Imposter::protocol).containsExactlyInAnyOrder(Protocol.HTTP, Protocol.TCP);
        assertThat(registry.list()).extracting(Imposter::name).contains("from-yaml");
    }

    @Test
    void loadsJsonImposters() throws Exception {
        Path file = Files.writeString(dir.resolve("imposters.json"), """
            {"imposters": [{"protocol": "smtp", "host": "127.0.0.1"}]}
            """);

        assertThat(loader.load(file)).isEqualTo(1);
        assertThat(registry.list()).singleElement().extracting(Imposter::protocol).isEqualTo(Protocol.SMTP);
    }

    @Test
    void startupLoadUsesTheConfiguredFile() throws Exception {
        Path file = Files.writeString(dir.resolve("startup.json"), """
            {"imposters": [{"protocol": "http", "host": "127.0.0.1"}]}
            """);
        properties.getImposters().setConfigFile(file);

        loader.loadOnStartup();

        assertThat(registry.list()).hasSize(1);
    }

    @Test
    void missingOrBrokenFilesDoNotStopStartup() throws Exception {
        properties.getImposters().setConfigFile(dir.resolve("absent.json"));
        loader.loadOnStartup();

        Path broken = Files.writeString(dir.resolve("broken.json"), "{\"imposters\": [{\"protocol\": \"nope\"}]}");
        properties.getImposters().setConfigFile(broken);
        loader.loadOnStartup();

        assertThat(registry.list()).isEmpty();
        assertThatThrownBy(() -> loader.load(broken)).isInstanceOf(InvalidProtocolException.class);
    }
}
