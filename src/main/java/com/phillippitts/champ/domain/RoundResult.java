package com.phillippitts.champ.domain;

import java.util.Objects;

/**
 * Outcome of one endpoint within one round. Created once and never mutated.
 *
 * @param endpointName configured endpoint name
 * @param text         model answer, or an {@code ERROR: ...} description when the call failed
 * @param latencyMs    latency of the successful attempt; 0 for failures and timeouts
 * @param error        failure description, {@code "timeout"} for deadline misses, empty on success
 * @param success      whether the endpoint produced an answer
 */
public record RoundResult(
        String endpointName,
        String text,
        double latencyMs,
        String error,
        boolean success
) {
    public static final String TIMEOUT = "timeout";

    public RoundResult {
        Objects.requireNonNull(endpointName, "endpointName");
        text = text == null ? "" : text;
        error = error == null ? "" : error;
    }

    public static RoundResult success(String endpointName, String text, double latencyMs) {
        return new RoundResult(endpointName, text, latencyMs, "", true);
    }

    public static RoundResult failure(String endpointName, Throwable error) {
        String message = String.valueOf(error.getMessage());
        return new RoundResult(endpointName,
                "ERROR: " + error.getClass().getSimpleName() + ": " + message,
                0, message, false);
    }

    public static RoundResult timeout(String endpointName) {
        return new RoundResult(endpointName, "ERROR: Request timeout", 0, TIMEOUT, false);
    }
}
