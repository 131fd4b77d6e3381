package io.stubhive.imposter.model;

import java.time.Instant;

/**
 * @param data the framed message, as text or base64 depending on the imposter's {@link TcpMode}
 */
public record TcpImposterRequest(String requestFrom, String ip, Instant timestamp, String data)
    implements ImposterRequest {
}
