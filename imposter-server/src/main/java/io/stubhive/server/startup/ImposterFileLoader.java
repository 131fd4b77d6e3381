package io.stubhive.server.startup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.stubhive.imposter.error.ImposterException;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.snapshot.SnapshotDocument;
import io.stubhive.imposter.snapshot.SnapshotStore;
import io.stubhive.server.config.StubHiveProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the imposters of {@code stubhive.imposters.config-file} once the
 * application is ready. The file holds {@code {"imposters": [...]}} in JSON or YAML.
 */
@Component
public class ImposterFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ImposterFileLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final SnapshotStore snapshots;
    private final StubHiveProperties properties;

    public ImposterFileLoader(SnapshotStore snapshots, StubHiveProperties properties) {
        this.snapshots = snapshots;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        Path file = properties.getImposters().getConfigFile();
        if (file == null) {
            return;
        }
        if (!Files.isRegularFile(file)) {
            log.warn("Imposter config file not found: {}", file.toAbsolutePath());
            return;
        }
        try {
            int loaded = load(file);
            log.info("Loaded {} imposters from {}", loaded, file.toAbsolutePath());
        } catch (IOException | ImposterException e) {
            log.error("Failed to load imposters from {}: {}", file.toAbsolutePath(), e.getMessage(), e);
        }
    }

    public int load(Path file) throws IOException {
        ObjectMapper mapper = isYamlFile(file) ? yamlMapper : ImposterJson.mapper();
        JsonNode root = mapper.readTree(Files.readString(file));
        SnapshotDocument document = snapshots.fromJson(root);
        snapshots.restore(document);
        return document.imposters().size();
    }

    private static boolean isYamlFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
