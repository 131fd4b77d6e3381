package io.stubhive.imposter.protocol;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.stubhive.imposter.model.ImposterResponse;
import io.stubhive.imposter.model.SmtpImposterRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One SMTP conversation. Only the reply to the end of a message comes from
 * the imposter's stubs; every other command gets a fixed reply.
 */
final class SmtpSessionHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(SmtpSessionHandler.class);

    private final NettyServer server;
    private final RequestHandler handler;
    private String envelopeFrom;
    private final List<String> envelopeTo = new ArrayList<>();
    private List<String> dataLines;

    SmtpSessionHandler(NettyServer server, RequestHandler handler) {
        this.server = server;
        this.handler = handler;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ctx.writeAndFlush("220 stubhive ESMTP ready\r\n");
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String line) {
        if (dataLines != null) {
            readData(ctx, line);
            return;
        }
        String command = line.length() >= 4 ? line.substring(0, 4).toUpperCase(Locale.ROOT) : line.toUpperCase(Locale.ROOT);
        switch (command) {
            case "HELO", "EHLO" -> reply(ctx, "250 stubhive");
            case "MAIL" -> {
                envelopeFrom = pathArgument(line);
                envelopeTo.clear();
                reply(ctx, "250 OK");
            }
            case "RCPT" -> {
                envelopeTo.add(pathArgument(line));
                reply(ctx, "250 OK");
            }
            case "DATA" -> {
                dataLines = new ArrayList<>();
                reply(ctx, "354 End data with <CR><LF>.<CR><LF>");
            }
            case "RSET" -> {
                resetEnvelope();
                reply(ctx, "250 OK");
            }
            case "NOOP" -> reply(ctx, "250 OK");
            case "QUIT" -> server.dispatch(ctx, () -> "221 Bye",
                text -> ctx.writeAndFlush(text + "\r\n").addListener(ChannelFutureListener.CLOSE));
            default -> reply(ctx, "502 Command not implemented");
        }
    }

    private void readData(ChannelHandlerContext ctx, String line) {
        if (!".".equals(line)) {
            dataLines.add(line.startsWith("..") ? line.substring(1) : line);
            return;
        }
        SmtpImposterRequest request = SmtpMessageParser.parse(
            NettyServer.requestFrom(ctx.channel()),
            NettyServer.ip(ctx.channel()),
            envelopeFrom,
            List.copyOf(envelopeTo),
            dataLines);
        resetEnvelope();
        log.debug("Message from {} to {}", request.envelopeFrom(), request.envelopeTo());
        server.dispatch(ctx, () -> handler.handle(request), response -> write(ctx, response));
    }

    private void write(ChannelHandlerContext ctx, ImposterResponse response) {
        if (response.reset()) {
            ctx.close();
            return;
        }
        int code = response.payload().path("code").asInt(250);
        String message = response.payload().path("message").asText("OK: queued");
        ctx.writeAndFlush(code + " " + message + "\r\n");
    }

    // replies go through the dispatcher so they never overtake a pending message reply
    private void reply(ChannelHandlerContext ctx, String text) {
        server.dispatch(ctx, () -> text, value -> ctx.writeAndFlush(value + "\r\n"));
    }

    private void resetEnvelope() {
        envelopeFrom = null;
        envelopeTo.clear();
        dataLines = null;
    }

    static String pathArgument(String line) {
        int colon = line.indexOf(':');
        String argument = colon < 0 ? "" : line.substring(colon + 1).trim();
        int open = argument.indexOf('<');
        int close = argument.indexOf('>');
        if (open >= 0 && close > open) {
            return argument.substring(open + 1, close).trim();
        }
        int space = argument.indexOf(' ');
        return space < 0 ? argument : argument.substring(0, space);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("SMTP imposter connection {} failed", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
