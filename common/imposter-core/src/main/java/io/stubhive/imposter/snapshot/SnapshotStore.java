package io.stubhive.imposter.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.MalformedSnapshotException;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.registry.Imposter;
import io.stubhive.imposter.registry.ImposterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves the registry to a portable document and restores it from one. Saving
 * replaces proxy entries by what they recorded, so a restored registry never
 * contacts an origin.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final ImposterRegistry registry;

    public SnapshotStore(ImposterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public SnapshotDocument save() {
        List<ImposterDefinition> imposters = new ArrayList<>();
        for (Imposter imposter : registry.list()) {
            imposters.add(imposter.toDefinition(true));
        }
        return new SnapshotDocument(imposters);
    }

    public void restore(SnapshotDocument document) {
        registry.replaceAll(document.imposters());
        log.info("Restored {} imposters", document.imposters().size());
    }

    /**
     * Turns every live proxy into the responses it has recorded so far.
     */
    public SnapshotDocument replay() {
        SnapshotDocument saved = save();
        restore(saved);
        return saved;
    }

    public ObjectNode toJson(SnapshotDocument document) {
        ObjectNode root = ImposterJson.objectNode();
        ArrayNode imposters = root.putArray("imposters");
        document.imposters().forEach(imposter -> imposters.add(ImposterJsonCodec.writeDefinition(imposter)));
        return root;
    }

    public SnapshotDocument fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedSnapshotException("a snapshot must be a JSON object with an imposters array");
        }
        JsonNode imposters = root.get("imposters");
        if (imposters == null || imposters.isNull()) {
            return new SnapshotDocument(List.of());
        }
        if (!imposters.isArray()) {
            throw new MalformedSnapshotException("imposters must be an array");
        }
        List<ImposterDefinition> definitions = new ArrayList<>();
        imposters.forEach(imposter -> definitions.add(ImposterJsonCodec.readImposter(imposter)));
        return new SnapshotDocument(definitions);
    }

    public SnapshotDocument parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedSnapshotException("snapshot document is empty");
        }
        try {
            return fromJson(ImposterJson.mapper().readTree(text));
        } catch (JsonProcessingException ex) {
            throw new MalformedSnapshotException("snapshot is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public void write(Path path) throws IOException {
        SnapshotDocument document = save();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = ImposterJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(toJson(document));
        Files.writeString(path, json, StandardCharsets.UTF_8);
        log.info("Saved {} imposters to {}", document.imposters().size(), path);
    }

    public SnapshotDocument read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }
}
