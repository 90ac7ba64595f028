package com.phillippitts.champ.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Latest observations published by the feed handler and read when a round starts.
 *
 * @param symbol         traded pair
 * @param price          last trade price (meaningless until {@link #hasPrice()})
 * @param solTipsProxy   Solana tip activity proxy
 * @param solWhalesProxy Solana whale activity proxy
 * @param trendingSource feed name
 * @param updatedAt      time of the last price update, null if none yet
 */
public record MarketSnapshot(
        String symbol,
        double price,
        double solTipsProxy,
        double solWhalesProxy,
        String trendingSource,
        Instant updatedAt
) {
    public MarketSnapshot {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(trendingSource, "trendingSource");
    }

    public static MarketSnapshot empty(String symbol, String trendingSource) {
        return new MarketSnapshot(symbol, 0.0, 0.0, 0.0, trendingSource, null);
    }

    public boolean hasPrice() {
        return updatedAt != null;
    }

    public MarketSnapshot withTrade(String tradeSymbol, double tradePrice, Instant at) {
        return new MarketSnapshot(tradeSymbol, tradePrice, solTipsProxy, solWhalesProxy, trendingSource, at);
    }
}
