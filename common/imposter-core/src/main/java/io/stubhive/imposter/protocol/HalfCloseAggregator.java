package io.stubhive.imposter.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.handler.codec.TooLongFrameException;

/**
 * Collects everything a client sends until it shuts down its output, then
 * passes the whole of it on as one message.
 */
final class HalfCloseAggregator extends ChannelInboundHandlerAdapter {

    private final int maxBytes;
    private CompositeByteBuf buffer;

    HalfCloseAggregator(int maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof ByteBuf bytes)) {
            ctx.fireChannelRead(msg);
            return;
        }
        if (buffer == null) {
            buffer = ctx.alloc().compositeBuffer();
        }
        if (buffer.readableBytes() + bytes.readableBytes() > maxBytes) {
            bytes.release();
            release();
            throw new TooLongFrameException("request exceeds " + maxBytes + " bytes");
        }
        buffer.addComponent(true, bytes);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            ByteBuf request = buffer == null ? ctx.alloc().buffer(0) : buffer;
            buffer = null;
            ctx.fireChannelRead(request);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        release();
        super.channelInactive(ctx);
    }

    private void release() {
        if (buffer != null) {
            buffer.release();
            buffer = null;
        }
    }
}
