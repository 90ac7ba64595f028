package com.phillippitts.champ.service.stream;

import java.io.IOException;

/**
 * One open inbound stream connection.
 */
public interface StreamSession extends AutoCloseable {

    /**
     * Blocks until the next text message arrives.
     *
     * @return message text, or null when the remote side closed the stream normally
     * @throws IOException on transport error or when the keepalive deadline is missed
     */
    String nextMessage() throws IOException;

    /**
     * Closes the connection. Never throws; close failures are logged by implementations.
     */
    @Override
    void close();
}
