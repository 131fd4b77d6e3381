package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.TcpOptions;

/**
 * What the resolver needs to know about the imposter a request arrived at.
 */
public record ResponseContext(Protocol protocol, int port, ObjectNode defaultResponse, TcpOptions tcp) {

    public ResponseContext {
        tcp = tcp == null ? TcpOptions.DEFAULTS : tcp;
    }
}
