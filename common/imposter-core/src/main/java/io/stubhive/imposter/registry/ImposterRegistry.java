package io.stubhive.imposter.registry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.ImposterException;
import io.stubhive.imposter.error.ImposterNotFoundException;
import io.stubhive.imposter.error.InvalidImposterException;
import io.stubhive.imposter.error.PortInUseException;
import io.stubhive.imposter.metrics.ImposterMetrics;
import io.stubhive.imposter.model.HttpBody;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.InjectResponse;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.ProxyResponse;
import io.stubhive.imposter.model.ResponseSpec;
import io.stubhive.imposter.model.StubDefinition;
import io.stubhive.imposter.model.TcpOptions;
import io.stubhive.imposter.predicate.PredicateCompiler;
import io.stubhive.imposter.protocol.NettyResources;
import io.stubhive.imposter.response.DisabledResponseInjector;
import io.stubhive.imposter.response.HttpProxyClient;
import io.stubhive.imposter.response.ResponseInjector;
import io.stubhive.imposter.response.ResponseResolver;
import io.stubhive.imposter.response.TcpProxyClient;
import io.stubhive.imposter.stub.Stub;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every live imposter, keyed by port.
 * <p>
 * Lifecycle changes are serialized on the registry and publish a new immutable
 * map; lookups read the current map and never block. A failed create or replace
 * leaves the previous set of imposters bound and serving.
 */
public class ImposterRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ImposterRegistry.class);

    private final RegistrySettings settings;
    private final NettyResources resources;
    private final ResponseResolver resolver;
    private final ImposterMetrics metrics;
    private final PredicateCompiler predicateCompiler = new PredicateCompiler();
    private volatile NavigableMap<Integer, Imposter> imposters = Collections.emptyNavigableMap();
    private boolean closed;

    public ImposterRegistry(RegistrySettings settings, ImposterMetrics metrics, ResponseInjector injector) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.resources = new NettyResources(settings.adapter());
        this.resolver = new ResponseResolver(
            List.of(
                new HttpProxyClient(settings.proxyTimeout()),
                new TcpProxyClient(resources.workerGroup(), settings.proxyTimeout(), settings.adapter().maxMessageBytes())),
            injector,
            metrics);
    }

    public static ImposterRegistry withDefaults() {
        return new ImposterRegistry(RegistrySettings.DEFAULTS, ImposterMetrics.inMemory(), DisabledResponseInjector.INSTANCE);
    }

    public RegistrySettings settings() {
        return settings;
    }

    public synchronized Imposter create(ImposterDefinition definition) {
        ensureOpen();
        Imposter imposter = prepare(definition);
        if (definition.port() != null && imposters.containsKey(definition.port())) {
            throw new PortInUseException(definition.port());
        }
        imposter.start(resources, settings.defaultHost());
        NavigableMap<Integer, Imposter> updated = new TreeMap<>(imposters);
        updated.put(imposter.port(), imposter);
        publish(updated);
        log.info("Created {} imposter on port {}", definition.protocol().wireValue(), imposter.port());
        return imposter;
    }

    /**
     * Stops and removes the imposter on {@code port}. Unknown ports are ignored.
     */
    public synchronized Optional<Imposter> delete(int port) {
        Imposter removed = imposters.get(port);
        if (removed == null) {
            return Optional.empty();
        }
        NavigableMap<Integer, Imposter> updated = new TreeMap<>(imposters);
        updated.remove(port);
        publish(updated);
        removed.stop();
        log.info("Deleted {} imposter on port {}", removed.protocol().wireValue(), port);
        return Optional.of(removed);
    }

    public synchronized List<Imposter> deleteAll() {
        List<Imposter> removed = List.copyOf(imposters.values());
        publish(new TreeMap<>());
        removed.forEach(Imposter::stop);
        if (!removed.isEmpty()) {
            log.info("Deleted {} imposters", removed.size());
        }
        return removed;
    }

    public Imposter get(int port) {
        Imposter imposter = imposters.get(port);
        if (imposter == null) {
            throw ImposterNotFoundException.forPort(port);
        }
        return imposter;
    }

    public List<Imposter> list() {
        return List.copyOf(imposters.values());
    }

    /**
     * Swaps the whole set of imposters. Every definition is validated before
     * anything is stopped; if a new imposter cannot bind, the ones already
     * started are stopped again and the previous imposters are rebound.
     */
    public synchronized void replaceAll(List<ImposterDefinition> definitions) {
        ensureOpen();
        Set<Integer> ports = new HashSet<>();
        List<Imposter> prepared = new ArrayList<>(definitions.size());
        for (ImposterDefinition definition : definitions) {
            if (definition.port() != null && !ports.add(definition.port())) {
                throw new InvalidImposterException("port " + definition.port() + " appears more than once");
            }
            prepared.add(prepare(definition));
        }

        // readers keep seeing the previous imposters until the new ones are bound
        List<Imposter> previous = List.copyOf(imposters.values());
        previous.forEach(Imposter::stop);

        List<Imposter> started = new ArrayList<>(prepared.size());
        try {
            for (Imposter imposter : prepared) {
                imposter.start(resources, settings.defaultHost());
                started.add(imposter);
            }
        } catch (ImposterException ex) {
            log.warn("Replacing imposters failed, restoring the previous {}: {}", previous.size(), ex.getMessage());
            started.forEach(Imposter::stop);
            NavigableMap<Integer, Imposter> restored = new TreeMap<>();
            for (Imposter imposter : previous) {
                try {
                    imposter.start(resources, settings.defaultHost());
                    restored.put(imposter.port(), imposter);
                } catch (ImposterException rebind) {
                    log.error("Could not rebind imposter on port {}", imposter.port(), rebind);
                }
            }
            publish(restored);
            throw ex;
        }
        NavigableMap<Integer, Imposter> replacement = new TreeMap<>();
        started.forEach(imposter -> replacement.put(imposter.port(), imposter));
        publish(replacement);
        log.info("Replaced {} imposters with {}", previous.size(), started.size());
    }

    public Imposter addStub(int port, StubDefinition stub, Integer index) {
        Imposter imposter = get(port);
        imposter.addStub(compile(imposter.protocol(), imposter.tcp(), stub), index);
        return imposter;
    }

    public Imposter replaceStubs(int port, List<StubDefinition> stubs) {
        Imposter imposter = get(port);
        imposter.replaceStubs(compileAll(imposter.protocol(), imposter.tcp(), stubs));
        return imposter;
    }

    public Imposter replaceStub(int port, int index, StubDefinition stub) {
        Imposter imposter = get(port);
        imposter.replaceStub(index, compile(imposter.protocol(), imposter.tcp(), stub));
        return imposter;
    }

    public Imposter deleteStub(int port, int index) {
        Imposter imposter = get(port);
        imposter.deleteStub(index);
        return imposter;
    }

    public Imposter clearRecordedRequests(int port) {
        Imposter imposter = get(port);
        imposter.clearRecordedRequests();
        return imposter;
    }

    private Imposter prepare(ImposterDefinition definition) {
        Integer port = definition.port();
        if (port != null && (port < 0 || port > 65535)) {
            throw new InvalidImposterException("port must be between 0 and 65535, got " + port);
        }
        if (definition.defaultResponse() != null) {
            checkPayload(definition.protocol(), definition.tcp(), definition.defaultResponse());
        }
        return new Imposter(definition, compileAll(definition.protocol(), definition.tcp(), definition.stubs()), resolver, metrics);
    }

    private List<Stub> compileAll(Protocol protocol, TcpOptions tcp, List<StubDefinition> stubs) {
        List<Stub> compiled = new ArrayList<>(stubs.size());
        for (StubDefinition stub : stubs) {
            compiled.add(compile(protocol, tcp, stub));
        }
        return compiled;
    }

    private Stub compile(Protocol protocol, TcpOptions tcp, StubDefinition stub) {
        for (ResponseSpec response : stub.responses()) {
            if (response instanceof IsResponse is) {
                checkPayload(protocol, tcp, is.fields());
            }
            if (response instanceof ProxyResponse && !protocol.supportsProxy()) {
                throw new InvalidImposterException("proxy responses are not supported for " + protocol.wireValue() + " imposters");
            }
            if (response instanceof InjectResponse && !settings.allowInjection()) {
                throw new InvalidImposterException("inject responses are disabled; enable stubhive.allow-injection to use them");
            }
        }
        return new Stub(stub, predicateCompiler.compileAll(stub.predicates()));
    }

    /**
     * Rejects payloads that could only fail once a request is being answered.
     */
    private static void checkPayload(Protocol protocol, TcpOptions tcp, ObjectNode payload) {
        switch (protocol) {
            case TCP -> tcp.effectiveMode().decode(payload.path("data").asText(""));
            case HTTP -> HttpBody.bytes(payload);
            case SMTP -> {
            }
        }
    }

    private void publish(NavigableMap<Integer, Imposter> updated) {
        imposters = Collections.unmodifiableNavigableMap(updated);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("registry is closed");
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        deleteAll();
        resolver.close();
        resources.close();
    }
}
