package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.ProxyUnreachableException;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.TcpOptions;

/**
 * Forwards a request to a real origin and returns its reply as an {@code is} payload.
 */
public interface ProxyClient extends AutoCloseable {

    Protocol protocol();

    /**
     * @param to      origin URL from the proxy entry
     * @param request the request received by the imposter
     * @param tcp     framing and mode of the imposter, used by TCP clients
     * @throws ProxyUnreachableException if the origin cannot be reached or does not reply in time
     */
    ObjectNode forward(String to, ImposterRequest request, TcpOptions tcp);

    @Override
    default void close() {
    }
}
