package com.phillippitts.champ.service.round;

import com.phillippitts.champ.domain.RoundRecord;
import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ledger.ChainedRoundLog;
import com.phillippitts.champ.service.ledger.CanonicalJson;
import com.phillippitts.champ.service.metrics.EnsembleMetrics;
import com.phillippitts.champ.service.metrics.EnsembleMetricsPublisher;
import com.phillippitts.champ.service.stream.MarketStateHolder;
import com.phillippitts.champ.testutil.FakeModelClient;
import com.phillippitts.champ.testutil.MutableClock;
import com.phillippitts.champ.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RoundSchedulerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.atEpochSecond(1_718_000_000L);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MarketStateHolder marketState = new MarketStateHolder("BTCUSDT", "binance");
    private EnsembleOrchestrator orchestrator;
    private ChainedRoundLog ledger;
    private RoundScheduler scheduler;

    @BeforeEach
    void setUp() {
        orchestrator = new EnsembleOrchestrator(
                List.of(FakeModelClient.answering("llama3_8b", "TRADE: long"), FakeModelClient.failing("mistral_7b")),
                new SyncExecutor(), new EnsembleOrchestrator.Settings(Duration.ofSeconds(5), 100), clock);
        ledger = new ChainedRoundLog(tempDir.resolve("rounds"), 100, clock);
        scheduler = new RoundScheduler(marketState, orchestrator, ledger,
                new EnsembleMetricsPublisher(new EnsembleMetrics(registry)), clock);
    }

    private double rounds(String outcome) {
        return registry.get("champ.rounds").tag("outcome", outcome).counter().count();
    }

    @Test
    void skipsUntilFirstPriceObserved() {
        Optional<String> root = scheduler.runRound();

        assertThat(root).isEmpty();
        assertThat(orchestrator.historySize()).isZero();
        assertThat(ledger.getCurrentRoot()).isEmpty();
        assertThat(rounds(RoundScheduler.OUTCOME_SKIPPED)).isEqualTo(1.0);
    }

    @Test
    void dispatchesAndLogsRoundFromLatestSnapshot() {
        marketState.recordTrade("BTCUSDT", 64_321.5, Instant.parse("2024-06-10T06:13:00Z"));

        Optional<String> root = scheduler.runRound();

        assertThat(root).isPresent();
        assertThat(ledger.getCurrentRoot()).isEqualTo(root);
        RoundRecord record = orchestrator.getRoundHistory().get(0);
        assertThat(record.context().price()).isEqualTo(64_321.5);
        assertThat(record.context().symbol()).isEqualTo("BTCUSDT");
        assertThat(record.context().timestamp()).isEqualTo(clock.instant());
        assertThat(record.context().roundId()).isEqualTo("round_1718000000");
        assertThat(record.results()).hasSize(2);
        assertThat(ChainedRoundLog.replay(List.of(CanonicalJson.toBytes(record)))).isEqualTo(root);
        assertThat(rounds(RoundScheduler.OUTCOME_LOGGED)).isEqualTo(1.0);
    }

    @Test
    void ledgerFailureIsCountedAndNotPropagated() throws IOException {
        marketState.recordTrade("BTCUSDT", 64_000.0, clock.instant());
        Path dir = tempDir.resolve("rounds");
        Files.delete(dir);
        Files.writeString(dir, "blocked");

        Optional<String> root = scheduler.runRound();

        assertThat(root).isEmpty();
        assertThat(orchestrator.historySize()).isEqualTo(1);
        assertThat(rounds(RoundScheduler.OUTCOME_LEDGER_FAILURE)).isEqualTo(1.0);

        Files.delete(dir);
        Files.createDirectories(dir);
        clock.advance(Duration.ofSeconds(30));
        assertThat(scheduler.runRound()).isPresent();
    }
}
