package io.stubhive.imposter.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stubhive.imposter.model.Protocol;
import java.util.Objects;

public class ImposterMetrics {

    private final MeterRegistry meterRegistry;

    public ImposterMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public static ImposterMetrics inMemory() {
        return new ImposterMetrics(new SimpleMeterRegistry());
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRequest(Timer.Sample sample, Protocol protocol, int port, boolean matched) {
        String protocolTag = protocol.wireValue();
        String portTag = Integer.toString(port);
        Counter.builder("imposter.requests")
            .description("Requests received by imposters")
            .tag("protocol", protocolTag)
            .tag("port", portTag)
            .tag("matched", Boolean.toString(matched))
            .register(meterRegistry)
            .increment();
        sample.stop(Timer.builder("imposter.request.duration")
            .description("Imposter request handling duration")
            .tag("protocol", protocolTag)
            .tag("port", portTag)
            .register(meterRegistry));
    }

    public void incrementProxyFailure(Protocol protocol, int port) {
        Counter.builder("imposter.proxy.failures")
            .description("Proxy calls that could not reach their origin")
            .tag("protocol", protocol.wireValue())
            .tag("port", Integer.toString(port))
            .register(meterRegistry)
            .increment();
    }

    public MeterRegistry registry() {
        return meterRegistry;
    }
}
