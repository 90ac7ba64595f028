package com.phillippitts.champ.config.round;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Round trigger settings. The interval is read by {@code @Scheduled} directly from
 * {@code champ.round.interval}; it is bound here for validation and status reporting.
 */
@ConfigurationProperties(prefix = "champ.round")
@Validated
public class RoundProperties {

    private boolean enabled = true;

    @NotNull
    private Duration interval = Duration.ofSeconds(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }
}
