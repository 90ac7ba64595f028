package com.phillippitts.champ.exception;

/**
 * Thrown when an inbound stream cannot be used: the connection fails or a message cannot be parsed.
 * Never escapes {@link com.phillippitts.champ.service.stream.StreamManager}; it is counted and retried.
 */
public class StreamException extends ChampException {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
