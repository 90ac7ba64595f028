package com.phillippitts.champ.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable input to one dispatch round: the market observations a prompt is built from.
 *
 * @param symbol          traded pair the observations refer to (e.g. "BTCUSDT")
 * @param price           last observed trade price
 * @param solTipsProxy    Solana priority-tip activity proxy
 * @param solWhalesProxy  Solana large-transfer activity proxy
 * @param trendingSource  name of the feed the observations came from
 * @param timestamp       when the observations were sampled
 * @param roundId         caller-assigned label for this context
 */
public record RoundContext(
        String symbol,
        double price,
        double solTipsProxy,
        double solWhalesProxy,
        String trendingSource,
        Instant timestamp,
        String roundId
) {
    public RoundContext {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(trendingSource, "trendingSource");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(roundId, "roundId");
    }
}
