package io.stubhive.imposter.protocol;

import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.stubhive.imposter.model.Protocol;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

public final class SmtpProtocolAdapter implements ProtocolAdapter {

    private final NettyServer server;

    public SmtpProtocolAdapter(NettyResources resources, RequestHandler handler) {
        int maxLineBytes = resources.settings().maxMessageBytes();
        this.server = new NettyServer(Protocol.SMTP, resources, false, (pipeline, server) -> {
            pipeline.addLast(new LineBasedFrameDecoder(maxLineBytes));
            pipeline.addLast(new StringDecoder(StandardCharsets.UTF_8));
            pipeline.addLast(new StringEncoder(StandardCharsets.UTF_8));
            pipeline.addLast(new SmtpSessionHandler(server, handler));
        });
    }

    @Override
    public Protocol protocol() {
        return Protocol.SMTP;
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
