package io.stubhive.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.snapshot.SnapshotDocument;
import io.stubhive.imposter.snapshot.SnapshotStore;
import io.stubhive.server.config.StubHiveProperties;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/snapshot", produces = MediaType.APPLICATION_JSON_VALUE)
public class SnapshotController {
    private static final Logger log = LoggerFactory.getLogger(SnapshotController.class);
    private final SnapshotStore snapshots;
    private final StubHiveProperties properties;

    public SnapshotController(SnapshotStore snapshots, StubHiveProperties properties) {
        this.snapshots = snapshots;
        this.properties = properties;
    }

    @GetMapping
    public ObjectNode save() {
        log.info("[REST] GET /snapshot");
        SnapshotDocument document = snapshots.save();
        log.info("[REST] GET /snapshot -> {} imposters", document.imposters().size());
        return snapshots.toJson(document);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode restore(@RequestBody JsonNode body) {
        log.info("[REST] PUT /snapshot body={}", LogJson.safe(body));
        snapshots.restore(snapshots.fromJson(body));
        return snapshots.toJson(snapshots.save());
    }

    @PostMapping("/replay")
    public ObjectNode replay() {
        log.info("[REST] POST /snapshot/replay");
        SnapshotDocument replayed = snapshots.replay();
        log.info("[REST] POST /snapshot/replay -> {} imposters", replayed.imposters().size());
        return snapshots.toJson(replayed);
    }

    @PostMapping("/file")
    public ObjectNode writeFile() throws IOException {
        Path file = properties.getSnapshot().getFile();
        log.info("[REST] POST /snapshot/file file={}", file);
        snapshots.write(file);
        ObjectNode result = snapshots.toJson(snapshots.read(file));
        result.put("file", file.toAbsolutePath().toString());
        return result;
    }
}
