package com.phillippitts.champ.config.alert;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Outbound alert webhook.
 */
@ConfigurationProperties(prefix = "champ.alert")
@Validated
public class AlertProperties {

    /** Webhook receiving JSON alerts; blank disables delivery. */
    private String webhook = "";

    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    /** Minimum gap between alerts for the same resource. */
    @NotNull
    private Duration throttle = Duration.ofMinutes(1);

    public String getWebhook() {
        return webhook;
    }

    public void setWebhook(String webhook) {
        this.webhook = webhook;
    }

    public boolean hasWebhook() {
        return webhook != null && !webhook.isBlank();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getThrottle() {
        return throttle;
    }

    public void setThrottle(Duration throttle) {
        this.throttle = throttle;
    }
}
