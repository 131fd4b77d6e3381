package io.stubhive.imposter.protocol;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpOptions;
import java.net.InetSocketAddress;

public final class TcpProtocolAdapter implements ProtocolAdapter {

    private final NettyServer server;

    public TcpProtocolAdapter(NettyResources resources, RequestHandler handler, TcpOptions options) {
        TcpFraming framing = options.effectiveFraming();
        int maxBytes = resources.settings().maxMessageBytes();
        boolean halfClose = framing.type() == TcpFraming.Type.CLOSE;
        this.server = new NettyServer(Protocol.TCP, resources, halfClose, (pipeline, server) -> {
            switch (framing.type()) {
                case DELIMITER -> pipeline.addLast(new DelimiterBasedFrameDecoder(
                    maxBytes, Unpooled.wrappedBuffer(framing.delimiterBytes())));
                case CLOSE -> pipeline.addLast(new HalfCloseAggregator(maxBytes));
                case CHUNK -> {
                }
            }
            pipeline.addLast(new TcpImposterHandler(server, handler, options.effectiveMode(), framing));
        });
    }

    @Override
    public Protocol protocol() {
        return Protocol.TCP;
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
