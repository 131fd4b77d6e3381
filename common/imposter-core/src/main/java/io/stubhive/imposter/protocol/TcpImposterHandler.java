package io.stubhive.imposter.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.stubhive.imposter.model.ImposterResponse;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpImposterRequest;
import io.stubhive.imposter.model.TcpMode;
import java.time.Instant;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns each framed TCP message into a request and writes back the resolved
 * {@code data}. A {@code null} reply means the connection is reset.
 */
final class TcpImposterHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(TcpImposterHandler.class);

    private final NettyServer server;
    private final RequestHandler handler;
    private final TcpMode mode;
    private final TcpFraming framing;

    TcpImposterHandler(NettyServer server, RequestHandler handler, TcpMode mode, TcpFraming framing) {
        this.server = server;
        this.handler = handler;
        this.mode = mode;
        this.framing = framing;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        TcpImposterRequest request = new TcpImposterRequest(
            NettyServer.requestFrom(ctx.channel()),
            NettyServer.ip(ctx.channel()),
            Instant.now(),
            mode.encode(ByteBufUtil.getBytes(msg)));
        log.debug("{} bytes from {}", msg.readableBytes(), request.requestFrom());
        server.dispatch(ctx, () -> encode(handler.handle(request)), reply -> write(ctx, reply));
    }

    private byte[] encode(ImposterResponse response) {
        if (response.reset()) {
            return null;
        }
        byte[] data = mode.decode(response.payload().path("data").asText(""));
        if (framing.type() == TcpFraming.Type.DELIMITER && !endsWith(data, framing.delimiterBytes())) {
            byte[] delimiter = framing.delimiterBytes();
            byte[] framed = Arrays.copyOf(data, data.length + delimiter.length);
            System.arraycopy(delimiter, 0, framed, data.length, delimiter.length);
            return framed;
        }
        return data;
    }

    private void write(ChannelHandlerContext ctx, byte[] reply) {
        if (reply == null) {
            ctx.close();
            return;
        }
        if (framing.type() == TcpFraming.Type.CLOSE) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(reply)).addListener(ChannelFutureListener.CLOSE);
        } else if (reply.length > 0) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(reply));
        }
    }

    private static boolean endsWith(byte[] bytes, byte[] suffix) {
        if (bytes.length < suffix.length) {
            return false;
        }
        int offset = bytes.length - suffix.length;
        for (int i = 0; i < suffix.length; i++) {
            if (bytes[offset + i] != suffix[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("TCP imposter connection {} failed", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
