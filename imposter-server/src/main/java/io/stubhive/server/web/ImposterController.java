package io.stubhive.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.InvalidImposterException;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.StubDefinition;
import io.stubhive.imposter.registry.Imposter;
import io.stubhive.imposter.registry.ImposterRegistry;
import io.stubhive.imposter.snapshot.ImposterJsonCodec;
import io.stubhive.imposter.snapshot.ImposterView;
import io.stubhive.imposter.snapshot.SnapshotStore;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/imposters", produces = MediaType.APPLICATION_JSON_VALUE)
public class ImposterController {
    private static final Logger log = LoggerFactory.getLogger(ImposterController.class);
    private final ImposterRegistry registry;
    private final SnapshotStore snapshots;
    private final ApiLinks links;

    public ImposterController(ImposterRegistry registry, SnapshotStore snapshots, ApiLinks links) {
        this.registry = registry;
        this.snapshots = snapshots;
        this.links = links;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ObjectNode> create(@RequestBody JsonNode body) {
        log.info("[REST] POST /imposters body={}", LogJson.safe(body));
        ImposterDefinition definition = ImposterJsonCodec.readImposter(body);
        Imposter imposter = registry.create(definition);
        log.info("[REST] POST /imposters -> status=201 port={}", imposter.port());
        return ResponseEntity.created(URI.create(links.imposter(imposter.port())))
            .body(document(imposter, ImposterView.FULL));
    }

    @GetMapping
    public ObjectNode list(@RequestParam(name = "replayable", defaultValue = "false") boolean replayable,
                           @RequestParam(name = "removeProxies", defaultValue = "false") boolean removeProxies) {
        log.info("[REST] GET /imposters replayable={} removeProxies={}", replayable, removeProxies);
        List<Imposter> imposters = registry.list();
        log.info("[REST] GET /imposters -> {} items", imposters.size());
        return documents(imposters, new ImposterView(replayable, removeProxies));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode replaceAll(@RequestBody JsonNode body) {
        log.info("[REST] PUT /imposters body={}", LogJson.safe(body));
        snapshots.restore(snapshots.fromJson(body));
        List<Imposter> imposters = registry.list();
        log.info("[REST] PUT /imposters -> status=200 imposters={}", imposters.size());
        return documents(imposters, ImposterView.FULL);
    }

    @DeleteMapping
    public ObjectNode deleteAll(@RequestParam(name = "replayable", defaultValue = "true") boolean replayable,
                                @RequestParam(name = "removeProxies", defaultValue = "false") boolean removeProxies) {
        log.info("[REST] DELETE /imposters");
        List<Imposter> deleted = registry.deleteAll();
        log.info("[REST] DELETE /imposters -> {} deleted", deleted.size());
        return documents(deleted, new ImposterView(replayable, removeProxies));
    }

    @GetMapping("/{port}")
    public ObjectNode one(@PathVariable("port") int port,
                          @RequestParam(name = "replayable", defaultValue = "false") boolean replayable,
                          @RequestParam(name = "removeProxies", defaultValue = "false") boolean removeProxies) {
        log.info("[REST] GET /imposters/{} replayable={} removeProxies={}", port, replayable, removeProxies);
        return document(registry.get(port), new ImposterView(replayable, removeProxies));
    }

    @DeleteMapping("/{port}")
    public ObjectNode delete(@PathVariable("port") int port,
                             @RequestParam(name = "replayable", defaultValue = "true") boolean replayable,
                             @RequestParam(name = "removeProxies", defaultValue = "false") boolean removeProxies) {
        log.info("[REST] DELETE /imposters/{}", port);
        Optional<Imposter> deleted = registry.delete(port);
        log.info("[REST] DELETE /imposters/{} -> found={}", port, deleted.isPresent());
        return deleted
            .map(imposter -> document(imposter, new ImposterView(replayable, removeProxies)))
            .orElseGet(ImposterJson::objectNode);
    }

    @DeleteMapping("/{port}/savedRequests")
    public ObjectNode clearRecordedRequests(@PathVariable("port") int port) {
        log.info("[REST] DELETE /imposters/{}/savedRequests", port);
        return document(registry.clearRecordedRequests(port), ImposterView.FULL);
    }

    @PostMapping(value = "/{port}/stubs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode addStub(@PathVariable("port") int port, @RequestBody JsonNode body) {
        log.info("[REST] POST /imposters/{}/stubs body={}", port, LogJson.safe(body));
        JsonNode stub = body.get("stub");
        if (stub == null || !stub.isObject()) {
            throw new InvalidImposterException("must contain a stub object");
        }
        JsonNode index = body.get("index");
        Integer position = index == null || index.isNull() ? null : index.asInt();
        return document(registry.addStub(port, ImposterJsonCodec.readStub(stub), position), ImposterView.FULL);
    }

    @PutMapping(value = "/{port}/stubs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode replaceStubs(@PathVariable("port") int port, @RequestBody JsonNode body) {
        log.info("[REST] PUT /imposters/{}/stubs body={}", port, LogJson.safe(body));
        JsonNode stubs = body.get("stubs");
        if (stubs == null || !stubs.isArray()) {
            throw new InvalidImposterException("must contain a stubs array");
        }
        List<StubDefinition> definitions = ImposterJsonCodec.readStubs(stubs);
        return document(registry.replaceStubs(port, definitions), ImposterView.FULL);
    }

    @PutMapping(value = "/{port}/stubs/{index}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode replaceStub(@PathVariable("port") int port, @PathVariable("index") int index,
                                  @RequestBody JsonNode body) {
        log.info("[REST] PUT /imposters/{}/stubs/{} body={}", port, index, LogJson.safe(body));
        return document(registry.replaceStub(port, index, ImposterJsonCodec.readStub(body)), ImposterView.FULL);
    }

    @DeleteMapping("/{port}/stubs/{index}")
    public ObjectNode deleteStub(@PathVariable("port") int port, @PathVariable("index") int index) {
        log.info("[REST] DELETE /imposters/{}/stubs/{}", port, index);
        return document(registry.deleteStub(port, index), ImposterView.FULL);
    }

    private ObjectNode documents(List<Imposter> imposters, ImposterView view) {
        ObjectNode root = ImposterJson.objectNode();
        ArrayNode items = root.putArray("imposters");
        imposters.forEach(imposter -> items.add(document(imposter, view)));
        return root;
    }

    private ObjectNode document(Imposter imposter, ImposterView view) {
        ObjectNode node = ImposterJsonCodec.writeImposter(imposter, view);
        if (!view.replayable()) {
            node.set("_links", links.imposterLinks(imposter.port()));
        }
        return node;
    }
}
