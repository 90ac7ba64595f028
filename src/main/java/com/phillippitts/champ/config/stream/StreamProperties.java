package com.phillippitts.champ.config.stream;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Trade stream connection settings.
 *
 * <p>When {@code champ.stream.url} is blank the Binance trade stream for {@code symbol} is used.
 */
@ConfigurationProperties(prefix = "champ.stream")
@Validated
public class StreamProperties {

    static final String DEFAULT_URL_TEMPLATE = "wss://stream.binance.com:9443/ws/%s@trade";

    /** Start the feed loop at startup. */
    private boolean enabled = true;

    @NotBlank
    private String symbol = "btcusdt";

    /** Explicit stream URL; overrides the symbol-derived default. */
    private String url = "";

    @NotBlank
    private String trendingSource = "binance";

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(1);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(32);

    /** Re-check interval while the breaker is open. */
    @NotNull
    private Duration breakerWait = Duration.ofSeconds(5);

    @Positive(message = "Circuit breaker failures must be positive")
    private int circuitBreakerFailures = 5;

    @NotNull
    private Duration circuitBreakerTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration pingInterval = Duration.ofSeconds(20);

    @NotNull
    private Duration pingTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Message silence tolerated before it counts as downtime. */
    @NotNull
    private Duration downtimeGrace = Duration.ofSeconds(30);

    /**
     * @return the configured URL, or the Binance trade stream for the symbol
     */
    public URI resolveUrl() {
        if (url != null && !url.isBlank()) {
            return URI.create(url.trim());
        }
        return URI.create(String.format(DEFAULT_URL_TEMPLATE, symbol.toLowerCase(Locale.ROOT)));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getTrendingSource() {
        return trendingSource;
    }

    public void setTrendingSource(String trendingSource) {
        this.trendingSource = trendingSource;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getBreakerWait() {
        return breakerWait;
    }

    public void setBreakerWait(Duration breakerWait) {
        this.breakerWait = breakerWait;
    }

    public int getCircuitBreakerFailures() {
        return circuitBreakerFailures;
    }

    public void setCircuitBreakerFailures(int circuitBreakerFailures) {
        this.circuitBreakerFailures = circuitBreakerFailures;
    }

    public Duration getCircuitBreakerTimeout() {
        return circuitBreakerTimeout;
    }

    public void setCircuitBreakerTimeout(Duration circuitBreakerTimeout) {
        this.circuitBreakerTimeout = circuitBreakerTimeout;
    }

    public Duration getPingInterval() {
        return pingInterval;
    }

    public void setPingInterval(Duration pingInterval) {
        this.pingInterval = pingInterval;
    }

    public Duration getPingTimeout() {
        return pingTimeout;
    }

    public void setPingTimeout(Duration pingTimeout) {
        this.pingTimeout = pingTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getDowntimeGrace() {
        return downtimeGrace;
    }

    public void setDowntimeGrace(Duration downtimeGrace) {
        this.downtimeGrace = downtimeGrace;
    }
}
