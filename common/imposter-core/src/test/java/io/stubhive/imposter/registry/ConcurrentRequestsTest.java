package io.stubhive.imposter.registry;

import static io.stubhive.imposter.support.Json.imposter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.stubhive.imposter.model.Protocol;
import io.stubhive.imposter.support.Http;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConcurrentRequestsTest {

    private static final int CLIENTS = 50;

    private ImposterRegistry registry;
    private ExecutorService clients;

    @BeforeEach
    void setUp() {
        registry = ImposterRegistry.withDefaults();
        clients = Executors.newFixedThreadPool(CLIENTS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        clients.shutdownNow();
        clients.awaitTermination(5, TimeUnit.SECONDS);
        registry.close();
    }

    private Map<String, Long> fire(int port) throws Exception {
        CountDownLatch go = new CountDownLatch(1);
        List<Future<String>> bodies = new ArrayList<>();
        for (int i = 0; i < CLIENTS; i++) {
            bodies.add(clients.submit(() -> {
                go.await();
                return Http.get(port, "/").body();
            }));
        }
        go.countDown();
        List<String> results = new ArrayList<>();
        for (Future<String> body : bodies) {
            results.add(body.get(30, TimeUnit.SECONDS));
        }
        return results.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    @Test
    void firstResponseIsServedOnceAndTheLastOneSticks() throws Exception {
        Imposter imposter = registry.create(imposter("""
            {"protocol": "http", "host": "127.0.0.1",
             "stubs": [{"responses": [{"is": {"body": "first"}}, {"is": {"body": "rest"}}]}]}
            """));

        Map<String, Long> counts = fire(imposter.port());

        assertThat(counts).containsEntry("first", 1L).containsEntry("rest", (long) CLIENTS - 1).hasSize(2);
        assertThat(imposter.numberOfRequests()).isEqualTo(CLIENTS);
        assertThat(imposter.stubs().get(0).matchCount()).isEqualTo(CLIENTS);
    }

    @Test
    void singleResponseIsServedToEveryone() throws Exception {
        Imposter imposter = registry.create(imposter("""
            {"protocol": "http", "host": "127.0.0.1", "stubs": [{"responses": [{"is": {"body": "same"}}]}]}
            """));

        assertThat(fire(imposter.port())).containsExactly(Map.entry("same", (long) CLIENTS));
    }

    private Imposter slow(String body, long waitMillis) {
        return registry.create(imposter("""
            {"protocol": "http", "host": "127.0.0.1",
             "stubs": [{"responses": [{"is": {"body": "%s"}, "_behaviors": {"wait": %d}}]}]}
            """.formatted(body, waitMillis)));
    }

    private static void awaitRequests(Imposter imposter, long count) {
        await().atMost(Duration.ofSeconds(5)).until(() -> imposter.numberOfRequests() >= count);
    }

    @Test
    void deleteLetsRequestsInFlightFinish() throws Exception {
        Imposter imposter = slow("slow", 1000);
        Future<String> inFlight = clients.submit(() -> Http.get(imposter.port(), "/").body());
        awaitRequests(imposter, 1);

        long started = System.nanoTime();
        registry.delete(imposter.port());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(500);
    }

    @Test
    void slowProxyDoesNotHoldUpTheNextResponse() throws Exception {
        Imposter origin = slow("origin", 1500);
        Imposter proxy = registry.create(imposter("""
            {"protocol": "http", "host": "127.0.0.1",
             "stubs": [{"responses": [{"proxy": {"to": "http://127.0.0.1:%d"}}, {"is": {"body": "local"}}]}]}
            """.formatted(origin.port())));

        Future<String> proxied = clients.submit(() -> Http.get(proxy.port(), "/").body());
        awaitRequests(origin, 1);

        assertThat(Http.get(proxy.port(), "/").body()).isEqualTo("local");
        assertThat(proxied.isDone()).isFalse();
        assertThat(proxied.get(10, TimeUnit.SECONDS)).isEqualTo("origin");
    }

    @Test
    void replaceAllKeepsThePreviousImpostersVisibleUntilTheNewOnesAreBound() throws Exception {
        Imposter old = slow("slow", 800);
        Future<String> inFlight = clients.submit(() -> Http.get(old.port(), "/").body());
        awaitRequests(old, 1);

        Future<?> replace = clients.submit(() -> registry.replaceAll(List.of(
            imposter("{\"protocol\": \"tcp\", \"host\": \"127.0.0.1\"}"))));
        AtomicBoolean sawEmpty = new AtomicBoolean();
        AtomicInteger reads = new AtomicInteger();
        while (!replace.isDone()) {
            if (registry.list().isEmpty()) {
                sawEmpty.set(true);
            }
            reads.incrementAndGet();
        }
        replace.get(5, TimeUnit.SECONDS);

        assertThat(reads.get()).isPositive();
        assertThat(sawEmpty).isFalse();
        assertThat(inFlight.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
        assertThat(registry.list()).singleElement().extracting(Imposter::protocol).isEqualTo(Protocol.TCP);
    }
}
