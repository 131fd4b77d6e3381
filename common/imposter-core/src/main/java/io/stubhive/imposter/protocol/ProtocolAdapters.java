package io.stubhive.imposter.protocol;

import io.stubhive.imposter.model.ImposterDefinition;

/**
 * Creates the adapter matching an imposter's protocol.
 */
public final class ProtocolAdapters {

    private ProtocolAdapters() {
    }

    public static ProtocolAdapter create(ImposterDefinition definition, RequestHandler handler, NettyResources resources) {
        return switch (definition.protocol()) {
            case HTTP -> new HttpProtocolAdapter(resources, handler);
            case TCP -> new TcpProtocolAdapter(resources, handler, definition.tcp());
            case SMTP -> new SmtpProtocolAdapter(resources, handler);
        };
    }
}
