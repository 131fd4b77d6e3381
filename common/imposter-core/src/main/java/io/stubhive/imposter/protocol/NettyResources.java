package io.stubhive.imposter.protocol;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event loops and the request executor shared by every imposter of a registry.
 * Requests run on the executor so that blocking proxy calls never hold an
 * event loop.
 */
public final class NettyResources implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyResources.class);

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService requestExecutor;
    private final AdapterSettings settings;

    public NettyResources(AdapterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("stubhive-boss", true));
        this.workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("stubhive-io", true));
        this.requestExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("stubhive-request", true));
    }

    public EventLoopGroup bossGroup() {
        return bossGroup;
    }

    public EventLoopGroup workerGroup() {
        return workerGroup;
    }

    public ExecutorService requestExecutor() {
        return requestExecutor;
    }

    public AdapterSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        log.debug("Shutting down imposter event loops");
        requestExecutor.shutdown();
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        try {
            if (!requestExecutor.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                requestExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            requestExecutor.shutdownNow();
        }
    }
}
