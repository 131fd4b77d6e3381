package io.stubhive.imposter.protocol;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.stubhive.imposter.error.BindFailureException;
import io.stubhive.imposter.error.PortInUseException;
import io.stubhive.imposter.model.Protocol;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listening socket plumbing shared by the protocol adapters: binding with
 * host checks, per-connection ordered dispatch onto the request executor and
 * a draining stop.
 */
final class NettyServer {

    private static final Logger log = LoggerFactory.getLogger(NettyServer.class);

    private static final AttributeKey<CompletableFuture<Void>> PENDING = AttributeKey.valueOf("stubhive.pending");

    private final Protocol protocol;
    private final NettyResources resources;
    private final BiConsumer<ChannelPipeline, NettyServer> pipelineConfigurer;
    private final boolean halfClosure;
    private final ChannelGroup clientChannels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final ConnectionLimitHandler connectionLimit;
    private final Object inFlightLock = new Object();
    private int inFlight;
    private volatile boolean stopping;
    private Channel serverChannel;

    NettyServer(Protocol protocol, NettyResources resources, boolean halfClosure,
                BiConsumer<ChannelPipeline, NettyServer> pipelineConfigurer) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.halfClosure = halfClosure;
        this.pipelineConfigurer = Objects.requireNonNull(pipelineConfigurer, "pipelineConfigurer");
        this.connectionLimit = new ConnectionLimitHandler(resources.settings().maxConnections());
    }

    synchronized InetSocketAddress bind(String host, Integer port) {
        if (serverChannel != null) {
            throw new IllegalStateException(protocol.wireValue() + " server already bound to " + serverChannel.localAddress());
        }
        int requestedPort = port == null ? 0 : port;
        InetSocketAddress address = localAddress(host, requestedPort);
        long idleSeconds = resources.settings().idleTimeout().toSeconds();

        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(resources.bossGroup(), resources.workerGroup())
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_REUSEADDR, true)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childOption(ChannelOption.ALLOW_HALF_CLOSURE, halfClosure)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    clientChannels.add(ch);
                    ChannelPipeline pipeline = ch.pipeline();
                    if (idleSeconds > 0) {
                        pipeline.addLast(new IdleStateHandler(idleSeconds, 0, 0, TimeUnit.SECONDS));
                    }
                    pipeline.addLast(connectionLimit);
                    pipelineConfigurer.accept(pipeline, NettyServer.this);
                }
            });

        ChannelFuture future = bootstrap.bind(address).awaitUninterruptibly();
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            if (cause instanceof BindException && String.valueOf(cause.getMessage()).contains("in use")) {
                throw new PortInUseException(requestedPort, cause);
            }
            throw new BindFailureException("cannot bind " + address + ": " + cause.getMessage(), cause);
        }
        serverChannel = future.channel();
        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        log.info("{} imposter listening on {}", protocol.wireValue(), bound);
        return bound;
    }

    static InetSocketAddress localAddress(String host, int port) {
        if (host == null || host.isBlank()) {
            return new InetSocketAddress(port);
        }
        InetAddress address;
        try {
            address = InetAddress.getByName(host);
        } catch (UnknownHostException ex) {
            throw new BindFailureException("cannot resolve host " + host, ex);
        }
        try {
            if (!address.isAnyLocalAddress()
                && !address.isLoopbackAddress()
                && NetworkInterface.getByInetAddress(address) == null) {
                throw new BindFailureException(host + " is not an address of this machine");
            }
        } catch (SocketException ex) {
            throw new BindFailureException("cannot inspect interfaces for " + host, ex);
        }
        return new InetSocketAddress(address, port);
    }

    /**
     * Runs {@code work} on the request executor and passes its result to
     * {@code writer} on the channel's event loop. Messages of one connection
     * are handled strictly one after another.
     */
    <T> void dispatch(ChannelHandlerContext ctx, Supplier<T> work, Consumer<T> writer) {
        Channel channel = ctx.channel();
        if (stopping) {
            channel.close();
            return;
        }
        beginRequest();
        CompletableFuture<Void> previous = channel.attr(PENDING).get();
        CompletableFuture<Void> start = previous == null ? CompletableFuture.completedFuture(null) : previous;
        CompletableFuture<Void> next = start
            .thenApplyAsync(ignored -> work.get(), resources.requestExecutor())
            .handle((result, error) -> {
                channel.eventLoop().execute(() -> {
                    try {
                        if (error != null) {
                            log.warn("Closing {} connection {} after failure", protocol.wireValue(),
                                channel.remoteAddress(), error);
                            channel.close();
                        } else if (channel.isActive()) {
                            writer.accept(result);
                        }
                    } finally {
                        endRequest();
                    }
                });
                return null;
            });
        channel.attr(PENDING).set(next);
    }

    private void beginRequest() {
        synchronized (inFlightLock) {
            inFlight++;
        }
    }

    private void endRequest() {
        synchronized (inFlightLock) {
            inFlight--;
            inFlightLock.notifyAll();
        }
    }

    void stop() {
        Channel channel;
        synchronized (this) {
            if (serverChannel == null || stopping) {
                return;
            }
            stopping = true;
            channel = serverChannel;
        }
        SocketAddress address = channel.localAddress();
        channel.config().setAutoRead(false);
        awaitInFlight();
        clientChannels.close().awaitUninterruptibly();
        channel.close().awaitUninterruptibly();
        log.info("{} imposter on {} stopped", protocol.wireValue(), address);
    }

    private void awaitInFlight() {
        long deadline = System.nanoTime() + resources.settings().shutdownGrace().toNanos();
        synchronized (inFlightLock) {
            while (inFlight > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    log.warn("{} imposter stopping with {} requests still in flight", protocol.wireValue(), inFlight);
                    return;
                }
                try {
                    inFlightLock.wait(remaining);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    static String ip(Channel channel) {
        if (channel.remoteAddress() instanceof InetSocketAddress remote && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return "";
    }

    static String requestFrom(Channel channel) {
        if (channel.remoteAddress() instanceof InetSocketAddress remote) {
            return ip(channel) + ":" + remote.getPort();
        }
        return String.valueOf(channel.remoteAddress());
    }
}
