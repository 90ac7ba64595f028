package com.phillippitts.champ.service.stream;

/**
 * Receives each inbound stream message. Throwing counts as a handler failure: the stream manager
 * records an error, notifies its circuit breaker and reconnects.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(String message) throws Exception;
}
