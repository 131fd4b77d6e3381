package io.stubhive.imposter.registry;

import static io.stubhive.imposter.support.Json.imposter;
import static org.assertj.core.api.Assertions.assertThat;

import io.stubhive.imposter.metrics.ImposterMetrics;
import io.stubhive.imposter.model.HttpImposterRequest;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.response.DisabledResponseInjector;
import io.stubhive.imposter.support.Http;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpProxyTest {

    private static final byte[] PNG = {-119, 80, 78, 71, -1, -40, 0, -128};

    private ImposterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ImposterRegistry(
            RegistrySettings.DEFAULTS.withProxyTimeout(Duration.ofSeconds(2)),
            ImposterMetrics.inMemory(),
            DisabledResponseInjector.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private Imposter http(String stubs) {
        return registry.create(imposter("""
            {"protocol": "http", "host": "127.0.0.1", "recordRequests": true, "stubs": %s}
            """.formatted(stubs)));
    }

    private Imposter proxyTo(Imposter origin, String mode) {
        return http("""
            [{"responses": [{"proxy": {"to": "http://127.0.0.1:%d", "mode": "%s"}}]}]
            """.formatted(origin.port(), mode));
    }

    @Test
    void binaryOriginBodyIsProxiedAndReplayedUnchanged() throws Exception {
        Imposter origin = http("""
            [{"responses": [{"is": {"headers": {"Content-Type": "image/png"}, "body": "%s", "_mode": "binary"}}]}]
            """.formatted(Base64.getEncoder().encodeToString(PNG)));
        Imposter proxy = proxyTo(origin, "proxyOnce");

        HttpResponse<byte[]> live = Http.getBytes(proxy.port(), "/logo.png");
        assertThat(live.body()).containsExactly(PNG);
        assertThat(live.headers().firstValue("Content-Type")).contains("image/png");

        assertThat(proxy.stubs().get(0).toDefinition(false).responses()).singleElement()
            .isInstanceOfSatisfying(IsResponse.class, recorded -> {
                assertThat(recorded.fields().get("_mode").asText()).isEqualTo("binary");
                assertThat(Base64.getDecoder().decode(recorded.fields().get("body").asText())).containsExactly(PNG);
            });

        registry.delete(origin.port());
        assertThat(Http.getBytes(proxy.port(), "/logo.png").body()).containsExactly(PNG);
    }

    @Test
    void invalidUtf8WithoutContentTypeIsTreatedAsBinary() throws Exception {
        Imposter origin = http("""
            [{"responses": [{"is": {"body": "%s", "_mode": "binary"}}]}]
            """.formatted(Base64.getEncoder().encodeToString(PNG)));
        Imposter proxy = proxyTo(origin, "proxyTransparent");

        assertThat(Http.getBytes(proxy.port(), "/").body()).containsExactly(PNG);
    }

    @Test
    void textOriginBodyIsRecordedAsText() throws Exception {
        Imposter origin = http("""
            [{"responses": [{"is": {"headers": {"Content-Type": "text/plain; charset=utf-8"}, "body": "héllo"}}]}]
            """);
        Imposter proxy = proxyTo(origin, "proxyOnce");

        assertThat(Http.get(proxy.port(), "/").body()).isEqualTo("héllo");
        assertThat(proxy.stubs().get(0).toDefinition(false).responses()).singleElement()
            .isInstanceOfSatisfying(IsResponse.class, recorded -> {
                assertThat(recorded.fields().get("body").asText()).isEqualTo("héllo");
                assertThat(recorded.fields().has("_mode")).isFalse();
            });
    }

    @Test
    void binaryRequestBodyIsForwardedUnchanged() throws Exception {
        Imposter origin = http("[]");
        Imposter proxy = proxyTo(origin, "proxyTransparent");

        Http.postBytes(proxy.port(), "/upload", "application/octet-stream", PNG);

        assertThat(origin.recordedRequests()).singleElement()
            .isInstanceOfSatisfying(HttpImposterRequest.class, forwarded -> {
                assertThat(forwarded.path()).isEqualTo("/upload");
                assertThat(forwarded.rawBody()).containsExactly(PNG);
            });
    }
}
