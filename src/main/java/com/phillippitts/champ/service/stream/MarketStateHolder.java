package com.phillippitts.champ.service.stream;

import com.phillippitts.champ.domain.MarketSnapshot;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state between the feed read loop (writer) and the round scheduler (reader).
 * Readers always receive an immutable {@link MarketSnapshot}.
 */
public class MarketStateHolder {

    private final AtomicReference<MarketSnapshot> current;

    public MarketStateHolder(String symbol, String trendingSource) {
        this.current = new AtomicReference<>(MarketSnapshot.empty(symbol, trendingSource));
    }

    public MarketSnapshot current() {
        return current.get();
    }

    public void recordTrade(String symbol, double price, Instant at) {
        current.updateAndGet(snapshot -> snapshot.withTrade(symbol, price, at));
    }
}
