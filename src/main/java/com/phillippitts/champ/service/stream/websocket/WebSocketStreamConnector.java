package com.phillippitts.champ.service.stream.websocket;

import com.phillippitts.champ.service.stream.StreamConnector;
import com.phillippitts.champ.service.stream.StreamSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link StreamConnector} over a Spring {@link WebSocketClient}.
 *
 * <p>The callback-driven websocket API is bridged to the pull model of {@link StreamSession}: the
 * handler queues text frames, pongs, transport errors and the close signal, and
 * {@link StreamSession#nextMessage()} drains the queue.
 *
 * <p><b>Keepalive:</b> when no frame arrives within {@code pingInterval} a ping is sent; if nothing
 * (not even a pong) arrives within {@code pingTimeout} after that, the read fails with an
 * {@link IOException} and the stream manager reconnects.
 */
public class WebSocketStreamConnector implements StreamConnector {

    private static final Logger LOG = LogManager.getLogger(WebSocketStreamConnector.class);

    private final WebSocketClient client;
    private final Duration connectTimeout;
    private final Duration pingInterval;
    private final Duration pingTimeout;

    public WebSocketStreamConnector(WebSocketClient client,
                                    Duration connectTimeout,
                                    Duration pingInterval,
                                    Duration pingTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
        this.pingTimeout = Objects.requireNonNull(pingTimeout, "pingTimeout");
    }

    @Override
    public StreamSession open(URI uri) throws IOException {
        QueueingHandler handler = new QueueingHandler();
        try {
            WebSocketSession session = client.execute(handler, new WebSocketHttpHeaders(), uri)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return new QueuedSession(session, handler.frames);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + uri, ie);
        } catch (ExecutionException ee) {
            throw new IOException("Failed to connect to " + uri, ee.getCause());
        } catch (TimeoutException te) {
            throw new IOException("Timed out connecting to " + uri + " after " + connectTimeout, te);
        }
    }

    private enum FrameKind { TEXT, PONG, ERROR, CLOSED }

    private record Frame(FrameKind kind, String payload, Throwable error) {
        static Frame text(String payload) {
            return new Frame(FrameKind.TEXT, payload, null);
        }

        static Frame pong() {
            return new Frame(FrameKind.PONG, null, null);
        }

        static Frame error(Throwable error) {
            return new Frame(FrameKind.ERROR, null, error);
        }

        static Frame closed(CloseStatus status) {
            return new Frame(FrameKind.CLOSED, String.valueOf(status), null);
        }
    }

    private static final class QueueingHandler extends TextWebSocketHandler {
        private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            frames.offer(Frame.text(message.getPayload()));
        }

        @Override
        protected void handlePongMessage(WebSocketSession session, PongMessage message) {
            frames.offer(Frame.pong());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            frames.offer(Frame.error(exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            frames.offer(Frame.closed(status));
        }
    }

    private final class QueuedSession implements StreamSession {
        private final WebSocketSession session;
        private final BlockingQueue<Frame> frames;

        private QueuedSession(WebSocketSession session, BlockingQueue<Frame> frames) {
            this.session = session;
            this.frames = frames;
        }

        @Override
        public String nextMessage() throws IOException {
            boolean pingOutstanding = false;
            while (true) {
                Duration wait = pingOutstanding ? pingTimeout : pingInterval;
                Frame frame;
                try {
                    frame = frames.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while reading stream", ie);
                }
                if (frame == null) {
                    if (pingOutstanding) {
                        throw new IOException("No frame received within " + pingTimeout + " after ping");
                    }
                    session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
                    pingOutstanding = true;
                } else if (frame.kind() == FrameKind.TEXT) {
                    return frame.payload();
                } else if (frame.kind() == FrameKind.PONG) {
                    pingOutstanding = false;
                } else if (frame.kind() == FrameKind.ERROR) {
                    throw new IOException("Stream transport error", frame.error());
                } else {
                    LOG.debug("Websocket closed: {}", frame.payload());
                    return null;
                }
            }
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close();
            } catch (IOException e) {
                LOG.debug("Error closing websocket session: {}", e.toString());
            }
        }
    }
}
