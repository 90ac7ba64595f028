package com.phillippitts.champ.service.alert;

import com.phillippitts.champ.config.alert.AlertProperties;
import com.phillippitts.champ.service.stream.event.CircuitOpenedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards circuit-open events to the configured webhook as JSON.
 *
 * <p>Alerts for the same resource are throttled to one per {@code champ.alert.throttle}. A blank
 * webhook drops the alert with a warning; delivery failures are logged and never propagate to the
 * publisher.
 */
@Component
public class AlertNotifier {

    private static final Logger LOG = LogManager.getLogger(AlertNotifier.class);

    private final AlertProperties properties;
    private final Clock clock;
    private final RestClient restClient;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();

    public AlertNotifier(AlertProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getTimeout());
        factory.setReadTimeout(properties.getTimeout());
        this.restClient = RestClient.builder().requestFactory(factory).build();
    }

    @EventListener
    public void onCircuitOpened(CircuitOpenedEvent event) {
        if (!shouldSend("circuit-open-" + event.resource())) {
            LOG.debug("Throttled circuit-open alert for {}", event.resource());
            return;
        }
        JSONObject payload = new JSONObject()
                .put("type", "circuit_open")
                .put("resource", event.resource())
                .put("failure_count", event.failureCount())
                .put("last_error", event.lastError() == null ? JSONObject.NULL : event.lastError())
                .put("timestamp", event.at().toString());
        send(payload);
    }

    /**
     * Posts the payload to the webhook.
     *
     * @return true if the webhook accepted it
     */
    public boolean send(JSONObject payload) {
        if (!properties.hasWebhook()) {
            LOG.warn("Alert webhook not configured; dropping alert: type={}", payload.optString("type"));
            return false;
        }
        try {
            restClient.post()
                    .uri(properties.getWebhook())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload.toString())
                    .retrieve()
                    .toBodilessEntity();
            LOG.info("Alert sent: type={}", payload.optString("type"));
            return true;
        } catch (RestClientException | IllegalArgumentException e) {
            LOG.error("Failed to send alert to {}: {}", properties.getWebhook(), e.getMessage());
            return false;
        }
    }

    // Package-private for tests
    boolean shouldSend(String key) {
        Instant now = clock.instant();
        Instant previous = lastSent.get(key);
        Duration throttle = properties.getThrottle();
        if (previous == null || Duration.between(previous, now).compareTo(throttle) > 0) {
            lastSent.put(key, now);
            return true;
        }
        return false;
    }
}
