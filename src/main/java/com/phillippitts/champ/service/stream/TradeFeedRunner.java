package com.phillippitts.champ.service.stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Starts the trade feed read loop on its own executor when the application context starts and
 * stops it on shutdown.
 */
public class TradeFeedRunner implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(TradeFeedRunner.class);

    private final StreamManager streamManager;
    private final URI uri;
    private final MessageHandler handler;
    private final Executor executor;

    public TradeFeedRunner(StreamManager streamManager, URI uri, MessageHandler handler, Executor executor) {
        this.streamManager = Objects.requireNonNull(streamManager, "streamManager");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void start() {
        if (streamManager.isRunning()) {
            return;
        }
        streamManager.start();
        executor.execute(() -> streamManager.run(uri, handler));
        LOG.info("Trade feed {} started: url={}", streamManager.getName(), uri);
    }

    @Override
    public void stop() {
        streamManager.stop();
        LOG.info("Trade feed {} stop requested", streamManager.getName());
    }

    @Override
    public boolean isRunning() {
        return streamManager.isRunning();
    }
}
