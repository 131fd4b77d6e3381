package io.stubhive.imposter.stub;

import com.fasterxml.jackson.databind.JsonNode;
import io.stubhive.imposter.model.IsResponse;
import io.stubhive.imposter.model.ProxyMode;
import io.stubhive.imposter.model.ProxyResponse;
import io.stubhive.imposter.model.ResponseSpec;
import io.stubhive.imposter.model.StubDefinition;
import io.stubhive.imposter.predicate.RequestPredicate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live stub: compiled predicates plus the mutable response cursor.
 * <p>
 * The cursor advances on every match and sticks at the last entry. Proxy
 * results are recorded against the slot they were selected from, so a
 * recording never shifts the positions other requests already hold.
 */
public final class Stub {

    private final List<JsonNode> predicates;
    private final RequestPredicate predicate;
    private final List<Slot> slots;
    private final ReentrantLock lock = new ReentrantLock();
    private int cursor;
    private long matchCount;

    public Stub(StubDefinition definition, RequestPredicate predicate) {
        Objects.requireNonNull(definition, "definition");
        this.predicates = definition.predicates();
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        List<Slot> initial = new ArrayList<>(definition.responses().size());
        for (ResponseSpec response : definition.responses()) {
            initial.add(new Slot(response));
        }
        this.slots = initial;
    }

    public boolean matches(JsonNode request) {
        return predicate.matches(request);
    }

    /**
     * Counts a match and returns the entry at the cursor.
     */
    public Selection next() {
        lock.lock();
        try {
            matchCount++;
            if (slots.isEmpty()) {
                return Selection.NONE;
            }
            int index = cursor;
            if (cursor < slots.size() - 1) {
                cursor++;
            }
            return new Selection(index, slots.get(index).spec);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits a live origin response for a proxy selection.
     *
     * @return {@code true} if the stub changed
     */
    public boolean recordProxyResult(Selection selection, IsResponse recorded) {
        if (!(selection.spec() instanceof ProxyResponse proxy) || proxy.mode() == ProxyMode.PROXY_TRANSPARENT) {
            return false;
        }
        lock.lock();
        try {
            Slot slot = slots.get(selection.slot());
            // a concurrent proxyOnce completion may already have replaced the entry
            if (slot.spec != selection.spec()) {
                return false;
            }
            if (proxy.mode() == ProxyMode.PROXY_ONCE) {
                slot.spec = recorded;
            } else {
                slot.recorded.add(recorded);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasProxies() {
        lock.lock();
        try {
            return slots.stream().anyMatch(slot -> slot.spec instanceof ProxyResponse);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current declared form of this stub.
     *
     * @param removeProxies replace each proxy entry with the responses it recorded
     */
    public StubDefinition toDefinition(boolean removeProxies) {
        lock.lock();
        try {
            List<ResponseSpec> responses = new ArrayList<>();
            for (Slot slot : slots) {
                if (removeProxies && slot.spec instanceof ProxyResponse) {
                    responses.addAll(slot.recorded);
                } else {
                    responses.add(slot.spec);
                }
            }
            return new StubDefinition(predicates, responses);
        } finally {
            lock.unlock();
        }
    }

    public long matchCount() {
        lock.lock();
        try {
            return matchCount;
        } finally {
            lock.unlock();
        }
    }

    private static final class Slot {
        private ResponseSpec spec;
        private final List<IsResponse> recorded = new ArrayList<>();

        private Slot(ResponseSpec spec) {
            this.spec = spec;
        }
    }
}
