package io.stubhive.imposter.protocol;

import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.stubhive.imposter.model.Protocol;
import java.net.InetSocketAddress;

public final class HttpProtocolAdapter implements ProtocolAdapter {

    private final NettyServer server;

    public HttpProtocolAdapter(NettyResources resources, RequestHandler handler) {
        int maxMessageBytes = resources.settings().maxMessageBytes();
        this.server = new NettyServer(Protocol.HTTP, resources, false, (pipeline, server) -> {
            pipeline.addLast(new HttpServerCodec());
            pipeline.addLast(new HttpObjectAggregator(maxMessageBytes));
            pipeline.addLast(new HttpImposterHandler(server, handler));
        });
    }

    @Override
    public Protocol protocol() {
        return Protocol.HTTP;
    }

    @Override
    public InetSocketAddress start(String host, Integer port) {
        return server.bind(host, port);
    }

    @Override
    public void stop() {
        server.stop();
    }
}
