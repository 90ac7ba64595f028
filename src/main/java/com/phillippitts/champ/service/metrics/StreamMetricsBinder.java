package com.phillippitts.champ.service.metrics;

import com.phillippitts.champ.service.stream.StreamManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes the trade stream's health counters as gauges tagged with the stream name.
 *
 * <p>Breaker state is encoded as 0 (closed), 1 (open), 2 (half-open). Each gauge takes a fresh
 * snapshot when scraped.
 */
@Component
public class StreamMetricsBinder implements MeterBinder {

    private final StreamManager streamManager;

    public StreamMetricsBinder(StreamManager streamManager) {
        this.streamManager = streamManager;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        String stream = streamManager.getName();
        Gauge.builder("champ.stream.messages", streamManager, m -> m.getHealthSnapshot().messageCount())
                .description("Messages received from the stream")
                .tag("stream", stream)
                .register(registry);
        Gauge.builder("champ.stream.errors", streamManager, m -> m.getHealthSnapshot().errorCount())
                .description("Connection and handler failures")
                .tag("stream", stream)
                .register(registry);
        Gauge.builder("champ.stream.reconnects", streamManager, m -> m.getHealthSnapshot().reconnectCount())
                .description("Successful connection opens")
                .tag("stream", stream)
                .register(registry);
        Gauge.builder("champ.stream.downtime.seconds", streamManager,
                        m -> m.getHealthSnapshot().totalDowntime().toMillis() / 1000.0)
                .description("Cumulative downtime beyond the grace period")
                .tag("stream", stream)
                .register(registry);
        Gauge.builder("champ.stream.circuit.state", streamManager,
                        m -> m.getHealthSnapshot().circuitState().ordinal())
                .description("Breaker state: 0 closed, 1 open, 2 half-open")
                .tag("stream", stream)
                .register(registry);
    }
}
