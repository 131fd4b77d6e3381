package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.stubhive.imposter.error.ProxyUnreachableException;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.TcpFraming;
import io.stubhive.imposter.model.TcpImposterRequest;
import io.stubhive.imposter.model.TcpMode;
import io.stubhive.imposter.model.TcpOptions;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards TCP imposter requests over a fresh Netty connection per request.
 * The origin's reply is read with the imposter's own framing.
 */
public final class TcpProxyClient implements ProxyClient {

    private static final Logger log = LoggerFactory.getLogger(TcpProxyClient.class);

    private final EventLoopGroup group;
    private final Duration timeout;
    private final int maxFrameBytes;

    public TcpProxyClient(EventLoopGroup group, Duration timeout, int maxFrameBytes) {
        this.group = Objects.requireNonNull(group, "group");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    public Protocol protocol() {
        return Protocol.TCP;
    }

    @Override
    public ObjectNode forward(String to, ImposterRequest request, TcpOptions tcp) {
        if (!(request instanceof TcpImposterRequest tcpRequest)) {
            throw new IllegalArgumentException("TCP proxy cannot forward " + request.getClass().getSimpleName());
        }
        URI origin = origin(to);
        TcpMode mode = tcp.effectiveMode();
        TcpFraming framing = tcp.effectiveFraming();
        byte[] payload = mode.decode(tcpRequest.data());
        if (framing.type() == TcpFraming.Type.DELIMITER) {
            payload = concat(payload, framing.delimiterBytes());
        }
        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        byte[] outbound = payload;

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (framing.type() == TcpFraming.Type.DELIMITER) {
                        pipeline.addLast(new DelimiterBasedFrameDecoder(maxFrameBytes,
                            Unpooled.wrappedBuffer(framing.delimiterBytes())));
                    }
                    pipeline.addLast(new ReplyHandler(framing.type(), outbound, reply));
                }
            });

        log.debug("Proxying {} bytes to {}", outbound.length, to);
        ChannelFuture connect = bootstrap.connect(origin.getHost(), origin.getPort());
        Channel channel = connect.channel();
        try {
            if (!connect.awaitUninterruptibly().isSuccess()) {
                throw new ProxyUnreachableException("cannot reach " + to + ": " + connect.cause().getMessage(), connect.cause());
            }
            byte[] bytes = reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            ObjectNode result = ImposterJson.objectNode();
            result.put("data", mode.encode(bytes));
            return result;
        } catch (TimeoutException ex) {
            throw new ProxyUnreachableException("no reply from " + to + " within " + timeout.toMillis() + "ms", ex);
        } catch (ExecutionException ex) {
            throw new ProxyUnreachableException("cannot reach " + to + ": " + ex.getCause().getMessage(), ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProxyUnreachableException("interrupted while proxying to " + to, ex);
        } finally {
            channel.close();
        }
    }

    private static URI origin(String to) {
        try {
            URI uri = URI.create(to);
            if (!"tcp".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null || uri.getPort() < 0) {
                throw new ProxyUnreachableException("TCP proxy target must look like tcp://host:port, got " + to);
            }
            return uri;
        } catch (IllegalArgumentException ex) {
            throw new ProxyUnreachableException("invalid proxy target " + to, ex);
        }
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] joined = new byte[first.length + second.length];
        System.arraycopy(first, 0, joined, 0, first.length);
        System.arraycopy(second, 0, joined, first.length, second.length);
        return joined;
    }

    private static final class ReplyHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private final TcpFraming.Type framing;
        private final byte[] payload;
        private final CompletableFuture<byte[]> reply;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        ReplyHandler(TcpFraming.Type framing, byte[] payload, CompletableFuture<byte[]> reply) {
            this.framing = framing;
            this.payload = payload;
            this.reply = reply;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener(written -> {
                if (!written.isSuccess()) {
                    reply.completeExceptionally(written.cause());
                } else if (framing == TcpFraming.Type.CLOSE) {
                    ((SocketChannel) ctx.channel()).shutdownOutput();
                }
            });
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
            byte[] chunk = new byte[msg.readableBytes()];
            msg.readBytes(chunk);
            if (framing == TcpFraming.Type.CLOSE) {
                buffer.writeBytes(chunk);
                return;
            }
            reply.complete(chunk);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            reply.complete(buffer.toByteArray());
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof ChannelInputShutdownEvent) {
                reply.complete(buffer.toByteArray());
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            reply.completeExceptionally(cause);
            ctx.close();
        }
    }
}
