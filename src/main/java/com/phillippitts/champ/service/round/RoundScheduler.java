package com.phillippitts.champ.service.round;

import com.phillippitts.champ.domain.MarketSnapshot;
import com.phillippitts.champ.domain.RoundContext;
import com.phillippitts.champ.domain.RoundRecord;
import com.phillippitts.champ.exception.LedgerException;
import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ledger.ChainedRoundLog;
import com.phillippitts.champ.service.metrics.EnsembleMetricsPublisher;
import com.phillippitts.champ.service.stream.MarketStateHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Periodic round trigger: samples the market state, runs one ensemble round and appends it to the
 * ledger.
 *
 * <p>Rounds are skipped until the feed has delivered a first price. Ledger failures are logged and
 * counted; the next round proceeds normally.
 */
@Component
@ConditionalOnProperty(prefix = "champ.round", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RoundScheduler {

    private static final Logger LOG = LogManager.getLogger(RoundScheduler.class);

    static final String OUTCOME_LOGGED = "logged";
    static final String OUTCOME_SKIPPED = "skipped";
    static final String OUTCOME_LEDGER_FAILURE = "ledger_failure";

    private final MarketStateHolder marketState;
    private final EnsembleOrchestrator orchestrator;
    private final ChainedRoundLog ledger;
    private final EnsembleMetricsPublisher metrics;
    private final Clock clock;

    public RoundScheduler(MarketStateHolder marketState,
                          EnsembleOrchestrator orchestrator,
                          ChainedRoundLog ledger,
                          EnsembleMetricsPublisher metrics,
                          Clock clock) {
        this.marketState = marketState;
        this.orchestrator = orchestrator;
        this.ledger = ledger;
        this.metrics = metrics == null ? EnsembleMetricsPublisher.NOOP : metrics;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${champ.round.interval:30s}", initialDelayString = "${champ.round.interval:30s}")
    public void scheduledRound() {
        runRound();
    }

    /**
     * Runs one round now.
     *
     * @return the new chain root, or empty if the round was skipped or could not be logged
     */
    public Optional<String> runRound() {
        MarketSnapshot snapshot = marketState.current();
        if (!snapshot.hasPrice()) {
            LOG.info("Skipping round: no {} price observed yet", snapshot.symbol());
            metrics.recordRound(OUTCOME_SKIPPED);
            return Optional.empty();
        }
        Instant now = clock.instant();
        String label = "round_" + now.getEpochSecond();
        RoundContext context = new RoundContext(snapshot.symbol(), snapshot.price(), snapshot.solTipsProxy(),
                snapshot.solWhalesProxy(), snapshot.trendingSource(), now, label);
        ThreadContext.put("roundId", label);
        try {
            RoundRecord record = orchestrator.executeRound(context);
            ThreadContext.put("roundId", record.roundId());
            String root = ledger.logRound(record);
            metrics.recordRound(OUTCOME_LOGGED);
            LOG.info("Round {} logged: {}/{} endpoints answered, root={}",
                    record.roundId(), record.successCount(), record.results().size(), root);
            return Optional.of(root);
        } catch (LedgerException e) {
            metrics.recordRound(OUTCOME_LEDGER_FAILURE);
            LOG.error("Round {} could not be logged: {}", label, e.getMessage(), e);
            return Optional.empty();
        } finally {
            ThreadContext.remove("roundId");
        }
    }
}
