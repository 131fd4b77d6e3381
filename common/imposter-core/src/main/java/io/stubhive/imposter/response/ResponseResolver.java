package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.ImposterException;
import io.stubhive.imposter.error.ProxyUnreachableException;
import io.stubhive.imposter.metrics.ImposterMetrics;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.ImposterResponse;
import io.stubhive.imposter.model.InjectResponse;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.ProxyResponse;
import io.stubhive.imposter.model.ResponseSpec;
import io.stubhive.imposter.stub.Selection;
import io.stubhive.imposter.stub.Stub;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the next response entry of a matched stub into a concrete response.
 * <p>
 * Proxy calls run on the calling thread without holding any stub lock; the
 * origin's reply is committed to the stub afterwards according to the proxy
 * mode. An unreachable origin becomes the protocol's proxy-failure response.
 */
public class ResponseResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseResolver.class);

    private final Map<Protocol, ProxyClient> proxyClients = new EnumMap<>(Protocol.class);
    private final ResponseInjector injector;
    private final ImposterMetrics metrics;

    public ResponseResolver(List<ProxyClient> proxyClients, ResponseInjector injector, ImposterMetrics metrics) {
        for (ProxyClient client : proxyClients) {
            this.proxyClients.put(client.protocol(), client);
        }
        this.injector = Objects.requireNonNull(injector, "injector");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Consumes the stub's current entry and produces its response.
     */
    public ImposterResponse resolve(ResponseContext imposter, Stub stub, ImposterRequest request) {
        Selection selection = stub.next();
        if (selection.isEmpty()) {
            return noMatch(imposter);
        }
        return selection.spec().accept(new ResponseSpec.Visitor<>() {
            @Override
            public ImposterResponse visitIs(IsResponse response) {
                return literal(imposter, response);
            }

            @Override
            public ImposterResponse visitProxy(ProxyResponse response) {
                return proxy(imposter, stub, selection, response, request);
            }

            @Override
            public ImposterResponse visitInject(InjectResponse response) {
                return inject(imposter, response, request);
            }
        });
    }

    /**
     * Response sent when no stub matches.
     */
    public ImposterResponse noMatch(ResponseContext imposter) {
        return ImposterResponse.of(ImposterJson.merge(imposter.protocol().defaultPayload(), imposter.defaultResponse()));
    }

    private ImposterResponse literal(ResponseContext imposter, IsResponse response) {
        if (response.hasWait()) {
            try {
                Thread.sleep(response.waitMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        return ImposterResponse.of(ImposterJson.merge(
            imposter.protocol().defaultPayload(), imposter.defaultResponse(), response.fields()));
    }

    private ImposterResponse proxy(ResponseContext imposter, Stub stub, Selection selection,
                                   ProxyResponse response, ImposterRequest request) {
        ProxyClient client = proxyClients.get(imposter.protocol());
        if (client == null) {
            return imposter.protocol().errorResponse("invalid proxy",
                "proxying is not supported for " + imposter.protocol().wireValue() + " imposters");
        }
        ObjectNode payload;
        try {
            payload = client.forward(response.to(), request, imposter.tcp());
        } catch (ProxyUnreachableException ex) {
            log.warn("Imposter :{} proxy to {} failed: {}", imposter.port(), response.to(), ex.getMessage());
            metrics.incrementProxyFailure(imposter.protocol(), imposter.port());
            return imposter.protocol().errorResponse(ex.code(), ex.getMessage());
        }
        if (stub.recordProxyResult(selection, IsResponse.of(payload))) {
            log.debug("Imposter :{} recorded {} response from {}", imposter.port(), response.mode().wireValue(), response.to());
        }
        return ImposterResponse.of(ImposterJson.merge(imposter.protocol().defaultPayload(), payload));
    }

    private ImposterResponse inject(ResponseContext imposter, InjectResponse response, ImposterRequest request) {
        try {
            ObjectNode payload = injector.inject(response, request, imposter);
            return ImposterResponse.of(ImposterJson.merge(
                imposter.protocol().defaultPayload(), imposter.defaultResponse(), payload));
        } catch (ImposterException ex) {
            log.warn("Imposter :{} injection failed: {}", imposter.port(), ex.getMessage());
            return imposter.protocol().errorResponse(ex.code(), ex.getMessage());
        }
    }

    @Override
    public void close() {
        proxyClients.values().forEach(ProxyClient::close);
    }
}
