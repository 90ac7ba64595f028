package com.phillippitts.champ.exception;

/**
 * Thrown when a model endpoint call fails.
 * Raised per attempt by transports (non-2xx status, malformed body, I/O error) and
 * by clients once the retry budget is exhausted.
 */
public class EndpointException extends ChampException {

    private final String endpointName;

    public EndpointException(String message) {
        super(message);
        this.endpointName = "unknown";
    }

    public EndpointException(String message, String endpointName) {
        super(message + " (endpoint: " + endpointName + ")");
        this.endpointName = endpointName;
    }

    public EndpointException(String message, Throwable cause) {
        super(message, cause);
        this.endpointName = "unknown";
    }

    public EndpointException(String message, String endpointName, Throwable cause) {
        super(message + " (endpoint: " + endpointName + ")", cause);
        this.endpointName = endpointName;
    }

    public String getEndpointName() {
        return endpointName;
    }
}
