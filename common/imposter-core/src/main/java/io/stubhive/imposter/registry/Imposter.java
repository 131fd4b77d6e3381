package io.stubhive.imposter.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Timer;
import io.stubhive.imposter.error.ImposterNotFoundException;
import io.stubhive.imposter.metrics.ImposterMetrics;
import io.stubhive.imposter.model.ImposterDefinition;
import io.stubhive.imposter.model.ImposterJson;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.ImposterResponse;
import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.model.StubDefinition;
import io.stubhive.imposter.model.TcpOptions;
import io.stubhive.imposter.protocol.NettyResources;
import io.stubhive.imposter.protocol.ProtocolAdapter;
import io.stubhive.imposter.protocol.ProtocolAdapters;
import io.stubhive.imposter.protocol.RequestHandler;
import io.stubhive.imposter.response.ResponseContext;
import io.stubhive.imposter.response.ResponseResolver;
import io.stubhive.imposter.stub.Stub;
import io.stubhive.imposter.stub.StubMatcher;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A live virtual server: its configuration, stubs and recorded requests, plus
 * the adapter bound for it.
 * <p>
 * The stub list is an immutable snapshot replaced under the imposter's lock,
 * so request threads never see a half-edited list.
 */
public final class Imposter implements RequestHandler {

    private final ImposterDefinition definition;
    private final ResponseResolver resolver;
    private final ImposterMetrics metrics;
    private final Object lock = new Object();
    private final ConcurrentLinkedQueue<ImposterRequest> recordedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicLong numberOfRequests = new AtomicLong();
    private volatile List<Stub> stubs;
    private volatile ResponseContext context;
    private ProtocolAdapter adapter;
    private int port;

    Imposter(ImposterDefinition definition, List<Stub> stubs, ResponseResolver resolver, ImposterMetrics metrics) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.stubs = List.copyOf(stubs);
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Binds a fresh adapter. A restarted imposter rebinds the port it held before.
     */
    void start(NettyResources resources, String defaultHost) {
        synchronized (lock) {
            ProtocolAdapter created = ProtocolAdapters.create(definition, this, resources);
            String host = definition.host() != null ? definition.host() : defaultHost;
            Integer requested = port > 0 ? Integer.valueOf(port) : definition.port();
            // requests can arrive as soon as the socket is bound
            context = contextFor(requested == null ? 0 : requested);
            InetSocketAddress bound = created.start(host, requested);
            port = bound.getPort();
            context = contextFor(port);
            adapter = created;
        }
    }

    private ResponseContext contextFor(int boundPort) {
        return new ResponseContext(definition.protocol(), boundPort, definition.defaultResponse(), definition.tcp());
    }

    void stop() {
        ProtocolAdapter current;
        synchronized (lock) {
            current = adapter;
            adapter = null;
        }
        if (current != null) {
            current.stop();
        }
    }

    @Override
    public ImposterResponse handle(ImposterRequest request) {
        Timer.Sample sample = metrics.startTimer();
        numberOfRequests.incrementAndGet();
        if (definition.recordRequests()) {
            recordedRequests.add(request);
        }
        ResponseContext current = context;
        JsonNode json = ImposterJson.toTree(request);
        Optional<Stub> match = StubMatcher.firstMatch(stubs, json);
        ImposterResponse response = match
            .map(stub -> resolver.resolve(current, stub, request))
            .orElseGet(() -> resolver.noMatch(current));
        metrics.recordRequest(sample, definition.protocol(), current.port(), match.isPresent());
        return response;
    }

    public int port() {
        synchronized (lock) {
            return port;
        }
    }

    public Protocol protocol() {
        return definition.protocol();
    }

    TcpOptions tcp() {
        return definition.tcp();
    }

    public String name() {
        return definition.name();
    }

    public boolean recordRequests() {
        return definition.recordRequests();
    }

    public long numberOfRequests() {
        return numberOfRequests.get();
    }

    public List<ImposterRequest> recordedRequests() {
        return List.copyOf(recordedRequests);
    }

    void clearRecordedRequests() {
        recordedRequests.clear();
    }

    public List<Stub> stubs() {
        return stubs;
    }

    void addStub(Stub stub, Integer index) {
        synchronized (lock) {
            List<Stub> updated = new ArrayList<>(stubs);
            int position = index == null ? updated.size() : index;
            if (position < 0 || position > updated.size()) {
                throw new ImposterNotFoundException("no stub position " + position + " on imposter " + port);
            }
            updated.add(position, stub);
            stubs = List.copyOf(updated);
        }
    }

    void replaceStubs(List<Stub> replacement) {
        synchronized (lock) {
            stubs = List.copyOf(replacement);
        }
    }

    void replaceStub(int index, Stub stub) {
        synchronized (lock) {
            List<Stub> updated = new ArrayList<>(stubs);
            checkIndex(index, updated.size());
            updated.set(index, stub);
            stubs = List.copyOf(updated);
        }
    }

    void deleteStub(int index) {
        synchronized (lock) {
            List<Stub> updated = new ArrayList<>(stubs);
            checkIndex(index, updated.size());
            updated.remove(index);
            stubs = List.copyOf(updated);
        }
    }

    private void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new ImposterNotFoundException("no stub at index " + index + " on imposter " + port);
        }
    }

    /**
     * Current stubs in declared form. With {@code removeProxies} every proxy
     * entry is replaced by its recordings and stubs left without responses are
     * dropped.
     */
    public List<StubSnapshot> stubSnapshots(boolean removeProxies) {
        List<StubSnapshot> snapshots = new ArrayList<>();
        for (Stub stub : stubs) {
            boolean proxied = stub.hasProxies();
            StubDefinition stubDefinition = stub.toDefinition(removeProxies);
            if (removeProxies && proxied && stubDefinition.responses().isEmpty()) {
                continue;
            }
            snapshots.add(new StubSnapshot(stubDefinition, stub.matchCount()));
        }
        return snapshots;
    }

    /**
     * Configuration as it stands now, with the bound port.
     */
    public ImposterDefinition toDefinition(boolean removeProxies) {
        return toDefinition(stubSnapshots(removeProxies));
    }

    /**
     * Configuration with the bound port and the given stub snapshots.
     */
    public ImposterDefinition toDefinition(List<StubSnapshot> snapshots) {
        List<StubDefinition> current = snapshots.stream()
            .map(StubSnapshot::definition)
            .toList();
        return definition.withPort(port()).withStubs(current);
    }
}
