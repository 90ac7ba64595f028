package com.phillippitts.champ.service.stream;

import java.io.IOException;
import java.net.URI;

/**
 * Opens long-lived inbound text streams.
 *
 * <p>Implementations wrap a concrete transport (websocket client) so {@link StreamManager} can be
 * exercised against scripted sessions in tests.
 */
@FunctionalInterface
public interface StreamConnector {

    /**
     * Opens a new session to {@code uri}.
     *
     * @param uri stream endpoint
     * @return an open session; the caller closes it
     * @throws IOException if the connection cannot be established
     */
    StreamSession open(URI uri) throws IOException;
}
