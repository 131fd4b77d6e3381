package io.stubhive.imposter.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Declared configuration of an imposter, the shape accepted by create and
 * produced by save.
 *
 * @param port            requested port, {@code null} for an ephemeral one
 * @param host            bind address, {@code null} for every interface
 * @param defaultResponse payload fields layered under every {@code is} response
 * @param tcp             TCP settings; ignored for other protocols
 */
public record ImposterDefinition(
    Protocol protocol,
    Integer port,
    String host,
    String name,
    boolean recordRequests,
    List<StubDefinition> stubs,
    ObjectNode defaultResponse,
    TcpOptions tcp
) {

    public ImposterDefinition {
        Objects.requireNonNull(protocol, "protocol");
        stubs = stubs == null ? List.of() : List.copyOf(stubs);
        tcp = tcp == null ? TcpOptions.DEFAULTS : tcp;
    }

    public static ImposterDefinition of(Protocol protocol, Integer port, List<StubDefinition> stubs) {
        return new ImposterDefinition(protocol, port, null, null, false, stubs, null, null);
    }

    public ImposterDefinition withPort(int boundPort) {
        return new ImposterDefinition(protocol, boundPort, host, name, recordRequests, stubs, defaultResponse, tcp);
    }

    public ImposterDefinition withStubs(List<StubDefinition> newStubs) {
        return new ImposterDefinition(protocol, port, host, name, recordRequests, newStubs, defaultResponse, tcp);
    }
}
