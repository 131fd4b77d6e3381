package io.stubhive.imposter.snapshot;

import static io.stubhive.imposter.support.Json.json;
import static io.stubhive.imposter.support.Json.object;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.stubhive.imposter.error.InvalidImposterException;
import io.stubhive.imposter.error.InvalidProtocolException;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.InjectResponse;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.ProxyMode;
import io.stubhive.imposter.model.ProxyResponse;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpMode;
import org.junit.jupiter.api.Test;

class ImposterJsonCodecTest {

    @Test
    void minimalImposterIsWrittenBackUnchanged() {
        JsonNode document = json("""
            {"protocol": "http", "port": 4545, "recordRequests": false, "stubs": []}
            """);

        assertThat(ImposterJsonCodec.writeDefinition(ImposterJsonCodec.readImposter(document))).isEqualTo(document);
    }

    @Test
    void fullImposterSurvivesReadAndWrite() {
        JsonNode document = json("""
            {
              "protocol": "http",
              "port": 4546,
              "name": "orders",
              "host": "127.0.0.1",
              "recordRequests": true,
              "defaultResponse": {"statusCode": 404},
              "stubs": [
                {
                  "predicates": [{"equals": {"method": "GET", "path": "/orders"}}],
                  "responses": [
                    {"is": {"statusCode": 200, "body": "first"}, "_behaviors": {"wait": 25}},
                    {"proxy": {"to": "http://origin:8080", "mode": "proxyAlways"}},
                    {"inject": "function (request) { return {}; }"}
                  ]
                }
              ]
            }
            """);

        ImposterDefinition definition = ImposterJsonCodec.readImposter(document);

        assertThat(definition.name()).isEqualTo("orders");
        assertThat(definition.recordRequests()).isTrue();
        assertThat(definition.stubs().get(0).responses())
            .satisfiesExactly(
                first -> assertThat(first).isEqualTo(new IsResponse(
                    object("{\"statusCode\": 200, \"body\": \"first\"}"), 25L)),
                second -> assertThat(second).isEqualTo(new ProxyResponse("http://origin:8080", ProxyMode.PROXY_ALWAYS)),
                third -> assertThat(third).isInstanceOf(InjectResponse.class));
        assertThat(ImposterJsonCodec.writeDefinition(definition)).isEqualTo(document);
    }

    @Test
    void liveStateAndUnknownKeysAreIgnored() {
        ImposterDefinition definition = ImposterJsonCodec.readImposter(json("""
            {"protocol": "tcp", "port": "5555", "numberOfRequests": 7, "requests": [{}],
             "_links": {"self": {"href": "x"}}, "somethingElse": true}
            """));

        assertThat(definition.protocol()).isEqualTo(Protocol.TCP);
        assertThat(definition.port()).isEqualTo(5555);
        assertThat(ImposterJsonCodec.writeDefinition(definition).has("somethingElse")).isFalse();
    }

    @Test
    void missingPortMeansEphemeral() {
        assertThat(ImposterJsonCodec.readImposter(json("{\"protocol\": \"smtp\"}")).port()).isNull();
    }

    @Test
    void tcpOptionsSurviveReadAndWrite() {
        JsonNode document = json("""
            {"protocol": "tcp", "port": 5556, "recordRequests": false, "mode": "binary",
             "framing": {"type": "delimiter", "delimiter": "\\n"}, "stubs": []}
            """);

        ImposterDefinition definition = ImposterJsonCodec.readImposter(document);

        assertThat(definition.tcp().mode()).isEqualTo(TcpMode.BINARY);
        assertThat(definition.tcp().framing()).isEqualTo(TcpFraming.delimiter("\n"));
        assertThat(ImposterJsonCodec.writeDefinition(definition)).isEqualTo(document);
    }

    @Test
    void responseWithoutIsDefaultsToEmptyLiteral() {
        assertThat(ImposterJsonCodec.readResponse(json("{}"))).isEqualTo(new IsResponse(null, null));
    }

    @Test
    void proxyModeDefaultsToProxyOnce() {
        assertThat(ImposterJsonCodec.readResponse(json("{\"proxy\": {\"to\": \"http://origin\"}}")))
            .isEqualTo(new ProxyResponse("http://origin", ProxyMode.PROXY_ONCE));
    }

    @Test
    void unknownProtocolIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readImposter(json("{\"protocol\": \"ftp\", \"port\": 21}")))
            .isInstanceOf(InvalidProtocolException.class)
            .hasMessageContaining("ftp");
    }

    @Test
    void missingProtocolIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readImposter(json("{\"port\": 4545}")))
            .isInstanceOf(InvalidProtocolException.class);
    }

    @Test
    void nonNumericPortIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readImposter(json("{\"protocol\": \"http\", \"port\": \"abc\"}")))
            .isInstanceOf(InvalidImposterException.class)
            .hasMessageContaining("port");
    }

    @Test
    void responseWithSeveralVariantsIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readResponse(json(
            "{\"is\": {}, \"proxy\": {\"to\": \"http://origin\"}}")))
            .isInstanceOf(InvalidImposterException.class);
    }

    @Test
    void proxyWithoutTargetIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readResponse(json("{\"proxy\": {}}")))
            .isInstanceOf(InvalidImposterException.class)
            .hasMessageContaining("proxy.to");
    }

    @Test
    void unknownProxyModeIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readResponse(json(
            "{\"proxy\": {\"to\": \"http://origin\", \"mode\": \"sometimes\"}}")))
            .isInstanceOf(InvalidImposterException.class);
    }

    @Test
    void delimiterFramingNeedsADelimiter() {
        assertThatThrownBy(() -> ImposterJsonCodec.readImposter(json(
            "{\"protocol\": \"tcp\", \"framing\": {\"type\": \"delimiter\"}}")))
            .isInstanceOf(InvalidImposterException.class)
            .hasMessageContaining("delimiter");
    }

    @Test
    void negativeWaitIsRejected() {
        assertThatThrownBy(() -> ImposterJsonCodec.readResponse(json("{\"is\": {}, \"_behaviors\": {\"wait\": -1}}")))
            .isInstanceOf(InvalidImposterException.class);
    }

    @Test
    void stubsMustBeAnArray() {
        assertThatThrownBy(() -> ImposterJsonCodec.readImposter(json("{\"protocol\": \"http\", \"stubs\": {}}")))
            .isInstanceOf(InvalidImposterException.class);
    }
}
