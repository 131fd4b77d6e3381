package io.stubhive.imposter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/**
 * @param body    request body decoded as UTF-8, used for matching and recording
 * @param rawBody the body exactly as received, forwarded unchanged by proxies
 */
public record HttpImposterRequest(
    String requestFrom,
    String ip,
    Instant timestamp,
    String method,
    String path,
    Map<String, String> query,
    Map<String, String> headers,
    String body,
    @JsonIgnore byte[] rawBody
) implements ImposterRequest {

    public HttpImposterRequest {
        query = query == null ? Map.of() : query;
        headers = headers == null ? Map.of() : headers;
        body = body == null ? "" : body;
        rawBody = rawBody == null ? body.getBytes(StandardCharsets.UTF_8) : rawBody;
    }

    public HttpImposterRequest(String requestFrom, String ip, Instant timestamp, String method, String path,
                               Map<String, String> query, Map<String, String> headers, String body) {
        this(requestFrom, ip, timestamp, method, path, query, headers, body, null);
    }
}
