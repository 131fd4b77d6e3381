package io.stubhive.imposter.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.InvalidImposterException;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.InjectResponse;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.ProxyMode;
import io.stubhive.imposter.model.ProxyResponse;
import io.stubhive.imposter.model.ResponseSpec;
import io.stubhive.imposter.model.StubDefinition;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpMode;
import io.stubhive.imposter.model.TcpOptions;
import io.stubhive.imposter.registry.Imposter;
import io.stubhive.imposter.registry.StubSnapshot;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the JSON documents used by the management API and by
 * snapshot files. Fields that only describe live state ({@code numberOfRequests},
 * {@code requests}, {@code matches}, {@code _links}) are ignored on input.
 */
public final class ImposterJsonCodec {

    private ImposterJsonCodec() {
    }

    public static ImposterDefinition readImposter(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidImposterException("an imposter must be a JSON object");
        }
        Protocol protocol = Protocol.fromWireValue(textOrNull(node, "protocol"));
        JsonNode portNode = node.get("port");
        Integer port = null;
        if (portNode != null && !portNode.isNull()) {
            if (portNode.isTextual()) {
                port = parsePort(portNode.asText());
            } else if (portNode.isIntegralNumber() && portNode.canConvertToInt()) {
                port = portNode.asInt();
            } else {
                throw new InvalidImposterException("port must be an integer, got " + portNode);
            }
        }
        JsonNode defaultResponse = node.get("defaultResponse");
        if (defaultResponse != null && !defaultResponse.isNull() && !defaultResponse.isObject()) {
            throw new InvalidImposterException("defaultResponse must be an object");
        }
        return new ImposterDefinition(
            protocol,
            port,
            textOrNull(node, "host"),
            textOrNull(node, "name"),
            node.path("recordRequests").asBoolean(false),
            readStubs(node.get("stubs")),
            defaultResponse != null && defaultResponse.isObject() ? ((ObjectNode) defaultResponse).deepCopy() : null,
            readTcpOptions(node));
    }

    public static List<StubDefinition> readStubs(JsonNode node) {
        List<StubDefinition> stubs = new ArrayList<>();
        if (node == null || node.isNull()) {
            return stubs;
        }
        if (!node.isArray()) {
            throw new InvalidImposterException("stubs must be an array");
        }
        for (JsonNode stub : node) {
            stubs.add(readStub(stub));
        }
        return stubs;
    }

    public static StubDefinition readStub(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidImposterException("a stub must be a JSON object");
        }
        List<JsonNode> predicates = new ArrayList<>();
        JsonNode predicateNodes = node.get("predicates");
        if (predicateNodes != null && !predicateNodes.isNull()) {
            if (!predicateNodes.isArray()) {
                throw new InvalidImposterException("predicates must be an array");
            }
            predicateNodes.forEach(predicate -> predicates.add(predicate.deepCopy()));
        }
        List<ResponseSpec> responses = new ArrayList<>();
        JsonNode responseNodes = node.get("responses");
        if (responseNodes != null && !responseNodes.isNull()) {
            if (!responseNodes.isArray()) {
                throw new InvalidImposterException("responses must be an array");
            }
            responseNodes.forEach(response -> responses.add(readResponse(response)));
        }
        return new StubDefinition(predicates, responses);
    }

    public static ResponseSpec readResponse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidImposterException("a response must be a JSON object");
        }
        int variants = (node.has("is") ? 1 : 0) + (node.has("proxy") ? 1 : 0) + (node.has("inject") ? 1 : 0);
        if (variants > 1) {
            throw new InvalidImposterException("a response takes one of is, proxy or inject: " + node);
        }
        if (node.has("proxy")) {
            JsonNode proxy = node.get("proxy");
            if (!proxy.isObject()) {
                throw new InvalidImposterException("proxy must be an object");
            }
            String mode = textOrNull(proxy, "mode");
            return new ProxyResponse(textOrNull(proxy, "to"), ProxyMode.fromWireValue(mode));
        }
        if (node.has("inject")) {
            JsonNode inject = node.get("inject");
            if (!inject.isTextual() || inject.asText().isBlank()) {
                throw new InvalidImposterException("inject must be a function source string");
            }
            return new InjectResponse(inject.asText());
        }
        JsonNode is = node.get("is");
        if (is != null && !is.isNull() && !is.isObject()) {
            throw new InvalidImposterException("is must be an object");
        }
        return new IsResponse(is != null && is.isObject() ? (ObjectNode) is : null, waitMillis(node));
    }

    private static Long waitMillis(JsonNode response) {
        JsonNode wait = response.path("_behaviors").path("wait");
        if (wait.isMissingNode() || wait.isNull()) {
            return null;
        }
        if (!wait.canConvertToLong() || wait.asLong() < 0) {
            throw new InvalidImposterException("_behaviors.wait must be a non-negative number of milliseconds");
        }
        return wait.asLong();
    }

    private static TcpOptions readTcpOptions(JsonNode node) {
        String mode = textOrNull(node, "mode");
        JsonNode framingNode = node.get("framing");
        TcpFraming framing = null;
        if (framingNode != null && !framingNode.isNull()) {
            if (!framingNode.isObject()) {
                throw new InvalidImposterException("framing must be an object");
            }
            String type = textOrNull(framingNode, "type");
            if (type == null) {
                throw new InvalidImposterException("framing.type is required");
            }
            framing = new TcpFraming(TcpFraming.Type.fromWireValue(type), textOrNull(framingNode, "delimiter"));
        }
        return new TcpOptions(mode == null ? null : TcpMode.fromWireValue(mode), framing);
    }

    private static Integer parsePort(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidImposterException("port must be an integer, got " + value, ex);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static ObjectNode writeDefinition(ImposterDefinition definition) {
        ObjectNode node = header(definition);
        ArrayNode stubs = node.putArray("stubs");
        definition.stubs().forEach(stub -> stubs.add(writeStub(stub)));
        return node;
    }

    /**
     * Document of a live imposter in the requested view.
     */
    public static ObjectNode writeImposter(Imposter imposter, ImposterView view) {
        List<StubSnapshot> snapshots = imposter.stubSnapshots(view.removeProxies());
        ObjectNode node = header(imposter.toDefinition(snapshots));
        ArrayNode stubs = node.putArray("stubs");
        for (StubSnapshot snapshot : snapshots) {
            ObjectNode stub = writeStub(snapshot.definition());
            if (!view.replayable()) {
                stub.put("matches", snapshot.matches());
            }
            stubs.add(stub);
        }
        if (!view.replayable()) {
            node.put("numberOfRequests", imposter.numberOfRequests());
            if (imposter.recordRequests()) {
                ArrayNode requests = node.putArray("requests");
                for (ImposterRequest request : imposter.recordedRequests()) {
                    requests.add(ImposterJson.toTree(request));
                }
            }
        }
        return node;
    }

    private static ObjectNode header(ImposterDefinition definition) {
        ObjectNode node = ImposterJson.objectNode();
        node.put("protocol", definition.protocol().wireValue());
        if (definition.port() != null) {
            node.put("port", definition.port());
        }
        if (definition.name() != null) {
            node.put("name", definition.name());
        }
        if (definition.host() != null) {
            node.put("host", definition.host());
        }
        node.put("recordRequests", definition.recordRequests());
        TcpOptions tcp = definition.tcp();
        if (tcp.mode() != null) {
            node.put("mode", tcp.mode().wireValue());
        }
        if (tcp.framing() != null) {
            ObjectNode framing = node.putObject("framing");
            framing.put("type", tcp.framing().type().wireValue());
            if (tcp.framing().delimiter() != null) {
                framing.put("delimiter", tcp.framing().delimiter());
            }
        }
        if (definition.defaultResponse() != null) {
            node.set("defaultResponse", definition.defaultResponse().deepCopy());
        }
        return node;
    }

    public static ObjectNode writeStub(StubDefinition stub) {
        ObjectNode node = ImposterJson.objectNode();
        if (!stub.predicates().isEmpty()) {
            ArrayNode predicates = node.putArray("predicates");
            stub.predicates().forEach(predicate -> predicates.add(predicate.deepCopy()));
        }
        ArrayNode responses = node.putArray("responses");
        stub.responses().forEach(response -> responses.add(writeResponse(response)));
        return node;
    }

    public static ObjectNode writeResponse(ResponseSpec response) {
        return response.accept(new ResponseSpec.Visitor<>() {
            @Override
            public ObjectNode visitIs(IsResponse is) {
                ObjectNode node = ImposterJson.objectNode();
                node.set("is", is.fields().deepCopy());
                if (is.waitMillis() != null) {
                    node.putObject("_behaviors").put("wait", is.waitMillis());
                }
                return node;
            }

            @Override
            public ObjectNode visitProxy(ProxyResponse proxy) {
                ObjectNode node = ImposterJson.objectNode();
                ObjectNode body = node.putObject("proxy");
                body.put("to", proxy.to());
                body.put("mode", proxy.mode().wireValue());
                return node;
            }

            @Override
            public ObjectNode visitInject(InjectResponse inject) {
                ObjectNode node = ImposterJson.objectNode();
                node.put("inject", inject.function());
                return node;
            }
        });
    }
}
