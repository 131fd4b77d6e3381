package io.stubhive.imposter.protocol;

import io.stubhive.imposter.model.Protocol;
import java.net.InetSocketAddress;

/**
 * Terminates connections for one imposter and hands each decoded message to
 * its {@link RequestHandler}.
 */
public interface ProtocolAdapter {

    Protocol protocol();

    /**
     * Binds the listening socket.
     *
     * @param host bind address, {@code null} for every interface
     * @param port requested port, {@code null} or {@code 0} for an ephemeral one
     * @return the address actually bound
     */
    InetSocketAddress start(String host, Integer port);

    /**
     * Stops accepting, drains in-flight requests and releases the socket.
     * Calling it more than once has no further effect.
     */
    void stop();
}
