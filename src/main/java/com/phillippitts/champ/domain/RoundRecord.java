package com.phillippitts.champ.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The unit persisted by the round ledger: one round's context and every endpoint result,
 * in configured endpoint order.
 */
public record RoundRecord(
        String roundId,
        Instant timestamp,
        RoundContext context,
        List<RoundResult> results
) {
    public RoundRecord {
        Objects.requireNonNull(roundId, "roundId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(context, "context");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long successCount() {
        return results.stream().filter(RoundResult::success).count();
    }
}
