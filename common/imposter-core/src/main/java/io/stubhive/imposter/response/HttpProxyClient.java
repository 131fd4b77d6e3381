package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.ProxyUnreachableException;
import io.stubhive.imposter.model.HttpBody;
import io.stubhive.imposter.model.HttpImposterRequest;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.TcpOptions;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards HTTP imposter requests with Apache HttpClient. Redirects are
 * returned to the caller rather than followed.
 */
public final class HttpProxyClient implements ProxyClient {

    private static final Logger log = LoggerFactory.getLogger(HttpProxyClient.class);

    private static final Set<String> HOP_BY_HOP = Set.of(
        "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
        "te", "trailer", "transfer-encoding", "upgrade", "content-length", "host");

    private final CloseableHttpClient httpClient;

    public HttpProxyClient(Duration timeout) {
        this(createClient(timeout));
    }

    HttpProxyClient(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    private static CloseableHttpClient createClient(Duration timeout) {
        Timeout limit = Timeout.of(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return HttpClients.custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(limit)
                    .setSocketTimeout(limit)
                    .build())
                .build())
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(limit)
                .setResponseTimeout(limit)
                .build())
            .disableRedirectHandling()
            .disableAutomaticRetries()
            .disableCookieManagement()
            .build();
    }

    @Override
    public Protocol protocol() {
        return Protocol.HTTP;
    }

    @Override
    public ObjectNode forward(String to, ImposterRequest request, TcpOptions tcp) {
        if (!(request instanceof HttpImposterRequest http)) {
            throw new IllegalArgumentException("HTTP proxy cannot forward " + request.getClass().getSimpleName());
        }
        HttpUriRequestBase outbound = new HttpUriRequestBase(http.method(), target(to, http));
        http.headers().forEach((name, value) -> {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                outbound.addHeader(name, value);
            }
        });
        if (http.rawBody().length > 0) {
            outbound.setEntity(new ByteArrayEntity(http.rawBody(), contentType(http.headers())));
        }
        log.debug("Proxying {} {} to {}", http.method(), http.path(), to);
        try {
            return httpClient.execute(outbound, response -> {
                ObjectNode payload = ImposterJson.objectNode();
                payload.put("statusCode", response.getCode());
                ObjectNode headers = payload.putObject("headers");
                for (Header header : response.getHeaders()) {
                    if (HOP_BY_HOP.contains(header.getName().toLowerCase(Locale.ROOT))) {
                        continue;
                    }
                    String name = header.getName();
                    headers.put(name, headers.has(name) ? headers.get(name).asText() + ", " + header.getValue() : header.getValue());
                }
                HttpEntity entity = response.getEntity();
                if (entity == null) {
                    payload.put("body", "");
                } else {
                    HttpBody.put(payload, EntityUtils.toByteArray(entity), entity.getContentType());
                }
                return payload;
            });
        } catch (IOException ex) {
            throw new ProxyUnreachableException("cannot reach " + to + ": " + ex.getMessage(), ex);
        }
    }

    private static URI target(String to, HttpImposterRequest request) {
        String base = to.endsWith("/") ? to.substring(0, to.length() - 1) : to;
        try {
            URIBuilder builder = new URIBuilder(base + request.path());
            request.query().forEach(builder::addParameter);
            return builder.build();
        } catch (URISyntaxException ex) {
            throw new ProxyUnreachableException("invalid proxy target " + to + request.path(), ex);
        }
    }

    private static ContentType contentType(Map<String, String> headers) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if ("content-type".equalsIgnoreCase(header.getKey()) && !header.getValue().isBlank()) {
                try {
                    return ContentType.parse(header.getValue());
                } catch (RuntimeException ex) {
                    return ContentType.APPLICATION_OCTET_STREAM;
                }
            }
        }
        return ContentType.APPLICATION_OCTET_STREAM;
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException ex) {
            log.warn("Failed to close proxy HTTP client", ex);
        }
    }
}
