package io.stubhive.imposter.model;

import io.stubhive.imposter.error.InvalidImposterException;
import java.util.Objects;

/**
 * @param to   origin URL, for example {@code http://origin:8080} or {@code tcp://origin:9000}
 * @param mode recording policy
 */
public record ProxyResponse(String to, ProxyMode mode) implements ResponseSpec {

    public ProxyResponse {
        if (to == null || to.isBlank()) {
            throw new InvalidImposterException("proxy.to is required");
        }
        mode = Objects.requireNonNullElse(mode, ProxyMode.PROXY_ONCE);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitProxy(this);
    }
}
