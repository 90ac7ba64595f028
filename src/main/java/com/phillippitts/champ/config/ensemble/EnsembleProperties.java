package com.phillippitts.champ.config.ensemble;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Model endpoints and dispatch tuning.
 *
 * <p>Properties:
 * <ul>
 *   <li>champ.ensemble.endpoints[n].name / .url - endpoints in dispatch order</li>
 *   <li>champ.ensemble.max-retries - retries after the first attempt (default: 3)</li>
 *   <li>champ.ensemble.retry-backoff - initial backoff seconds and growth factor (default: 1.5)</li>
 *   <li>champ.ensemble.circuit-breaker-failures - error count at which a client reports unhealthy (default: 5)</li>
 *   <li>champ.ensemble.request-timeout - per-attempt HTTP timeout (default: 30s)</li>
 *   <li>champ.ensemble.round-timeout - overall round deadline (default: 120s)</li>
 *   <li>champ.ensemble.history-capacity - rounds kept in memory (default: 1000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "champ.ensemble")
@Validated
public class EnsembleProperties {

    @NotEmpty(message = "At least one model endpoint must be configured")
    @Valid
    private List<Endpoint> endpoints = new ArrayList<>(List.of(
            new Endpoint("llama3_8b", "http://llama3-8b:8001/generate"),
            new Endpoint("mistral_7b", "http://mistral-7b:8002/generate")));

    @PositiveOrZero(message = "Max retries must not be negative")
    private int maxRetries = 3;

    @Positive(message = "Retry backoff must be positive")
    private double retryBackoff = 1.5;

    @Positive(message = "Circuit breaker failures must be positive")
    private int circuitBreakerFailures = 5;

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration roundTimeout = Duration.ofSeconds(120);

    @Positive(message = "History capacity must be positive")
    private int historyCapacity = 1000;

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<Endpoint> endpoints) {
        this.endpoints = endpoints;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public double getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(double retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getCircuitBreakerFailures() {
        return circuitBreakerFailures;
    }

    public void setCircuitBreakerFailures(int circuitBreakerFailures) {
        this.circuitBreakerFailures = circuitBreakerFailures;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getRoundTimeout() {
        return roundTimeout;
    }

    public void setRoundTimeout(Duration roundTimeout) {
        this.roundTimeout = roundTimeout;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    /**
     * One model endpoint.
     */
    public static class Endpoint {

        @NotBlank(message = "Endpoint name must not be blank")
        private String name;

        @NotBlank(message = "Endpoint url must not be blank")
        private String url;

        public Endpoint() {
        }

        public Endpoint(String name, String url) {
            this.name = name;
            this.url = url;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
