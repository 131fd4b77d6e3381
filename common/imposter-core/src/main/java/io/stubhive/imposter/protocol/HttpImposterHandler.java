package io.stubhive.imposter.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.stubhive.imposter.model.HttpBody;
import io.stubhive.imposter.model.HttpImposterRequest;
import io.stubhive.imposter.model.ImposterResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes aggregated HTTP requests for an imposter and writes its responses.
 */
final class HttpImposterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(HttpImposterHandler.class);

    private final NettyServer server;
    private final RequestHandler handler;

    HttpImposterHandler(NettyServer server, RequestHandler handler) {
        this.server = server;
        this.handler = handler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg) {
        if (msg.decoderResult().isFailure()) {
            FullHttpResponse badRequest = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.BAD_REQUEST);
            HttpUtil.setContentLength(badRequest, 0);
            ctx.writeAndFlush(badRequest).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        boolean keepAlive = HttpUtil.isKeepAlive(msg);
        HttpVersion version = msg.protocolVersion();
        HttpImposterRequest request = toRequest(ctx, msg);
        log.debug("{} {} from {}", request.method(), request.path(), request.requestFrom());
        server.dispatch(ctx, () -> handler.handle(request), response -> write(ctx, response, version, keepAlive));
    }

    private static HttpImposterRequest toRequest(ChannelHandlerContext ctx, FullHttpRequest msg) {
        QueryStringDecoder decoder = new QueryStringDecoder(msg.uri());
        Map<String, String> query = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> parameter : decoder.parameters().entrySet()) {
            List<String> values = parameter.getValue();
            query.put(parameter.getKey(), values.isEmpty() ? "" : values.get(0));
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : msg.headers()) {
            headers.merge(header.getKey(), header.getValue(), (first, second) -> first + ", " + second);
        }
        return new HttpImposterRequest(
            NettyServer.requestFrom(ctx.channel()),
            NettyServer.ip(ctx.channel()),
            Instant.now(),
            msg.method().name(),
            decoder.path(),
            query,
            headers,
            msg.content().toString(StandardCharsets.UTF_8),
            ByteBufUtil.getBytes(msg.content()));
    }

    private static void write(ChannelHandlerContext ctx, ImposterResponse response, HttpVersion version, boolean keepAlive) {
        if (response.reset()) {
            ctx.close();
            return;
        }
        ObjectNode payload = response.payload();
        byte[] body = HttpBody.bytes(payload);
        FullHttpResponse http = new DefaultFullHttpResponse(
            version,
            HttpResponseStatus.valueOf(payload.path("statusCode").asInt(200)),
            Unpooled.wrappedBuffer(body));
        HttpHeaders headers = http.headers();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.path("headers").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> header = fields.next();
            if (header.getValue().isArray()) {
                header.getValue().forEach(value -> headers.add(header.getKey(), value.asText()));
            } else {
                headers.set(header.getKey(), header.getValue().asText());
            }
        }
        headers.remove(HttpHeaderNames.TRANSFER_ENCODING);
        HttpUtil.setContentLength(http, body.length);
        if (keepAlive) {
            if (version == HttpVersion.HTTP_1_0) {
                headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }
            ctx.writeAndFlush(http);
        } else {
            headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("HTTP imposter connection {} failed", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
