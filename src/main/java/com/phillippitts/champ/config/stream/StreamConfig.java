package com.phillippitts.champ.config.stream;

import com.phillippitts.champ.service.resilience.CircuitBreaker;
import com.phillippitts.champ.service.stream.MarketStateHolder;
import com.phillippitts.champ.service.stream.StreamConnector;
import com.phillippitts.champ.service.stream.StreamManager;
import com.phillippitts.champ.service.stream.TradeFeedHandler;
import com.phillippitts.champ.service.stream.TradeFeedRunner;
import com.phillippitts.champ.service.stream.websocket.WebSocketStreamConnector;
import com.phillippitts.champ.util.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Wires the trade stream: breaker, websocket transport, manager, shared market state and the
 * lifecycle runner. The runner is skipped when {@code champ.stream.enabled=false}; the manager and
 * state still exist so health and rounds report an idle feed.
 */
@Configuration
public class StreamConfig {

    static final String STREAM_NAME = "trade-feed";

    private final StreamProperties properties;

    public StreamConfig(StreamProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CircuitBreaker streamCircuitBreaker(Clock clock) {
        return new CircuitBreaker(STREAM_NAME, properties.getCircuitBreakerFailures(),
                properties.getCircuitBreakerTimeout(), clock);
    }

    @Bean
    public StreamConnector streamConnector() {
        return new WebSocketStreamConnector(new StandardWebSocketClient(),
                properties.getConnectTimeout(), properties.getPingInterval(), properties.getPingTimeout());
    }

    @Bean
    public StreamManager streamManager(StreamConnector streamConnector,
                                       CircuitBreaker streamCircuitBreaker,
                                       Sleeper sleeper,
                                       Clock clock,
                                       ApplicationEventPublisher publisher) {
        StreamManager.Settings settings = new StreamManager.Settings(properties.getInitialBackoff(),
                properties.getMaxBackoff(), properties.getBreakerWait(), properties.getDowntimeGrace());
        return new StreamManager(STREAM_NAME, streamConnector, streamCircuitBreaker, settings, sleeper, clock, publisher);
    }

    @Bean
    public MarketStateHolder marketStateHolder() {
        return new MarketStateHolder(properties.getSymbol().toUpperCase(Locale.ROOT), properties.getTrendingSource());
    }

    @Bean
    public TradeFeedHandler tradeFeedHandler(MarketStateHolder marketStateHolder, Clock clock) {
        return new TradeFeedHandler(marketStateHolder, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "champ.stream", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TradeFeedRunner tradeFeedRunner(StreamManager streamManager,
                                           TradeFeedHandler tradeFeedHandler,
                                           @Qualifier("streamExecutor") Executor streamExecutor) {
        return new TradeFeedRunner(streamManager, properties.resolveUrl(), tradeFeedHandler, streamExecutor);
    }
}
