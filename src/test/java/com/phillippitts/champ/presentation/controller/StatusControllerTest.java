package com.phillippitts.champ.presentation.controller;

import com.phillippitts.champ.domain.RoundContext;
import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.ledger.ChainedRoundLog;
import com.phillippitts.champ.service.resilience.CircuitBreaker;
import com.phillippitts.champ.service.stream.StreamConnector;
import com.phillippitts.champ.service.stream.StreamManager;
import com.phillippitts.champ.testutil.FakeModelClient;
import com.phillippitts.champ.testutil.MutableClock;
import com.phillippitts.champ.testutil.RecordingSleeper;
import com.phillippitts.champ.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatusControllerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.atEpochSecond(1_718_000_000L);
    private EnsembleOrchestrator orchestrator;
    private ChainedRoundLog ledger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StreamManager streamManager = new StreamManager("trade-feed", mock(StreamConnector.class),
                new CircuitBreaker("trade-feed", 5, Duration.ofSeconds(60), clock),
                StreamManager.Settings.defaults(), new RecordingSleeper(), clock, null);
        orchestrator = new EnsembleOrchestrator(List.of(FakeModelClient.answering("llama3_8b", "TRADE: long")),
                new SyncExecutor(), new EnsembleOrchestrator.Settings(Duration.ofSeconds(5), 10), clock);
        ledger = new ChainedRoundLog(tempDir, 10, clock);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new StatusController(streamManager, orchestrator, ledger, clock))
                .build();
    }

    @Test
    void reportsEmptyChainBeforeFirstRound() throws Exception {
        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stream.circuit_breaker_state").value("CLOSED"))
                .andExpect(jsonPath("$.stream.message_count").value(0))
                .andExpect(jsonPath("$.ensemble.total_rounds").value(0))
                .andExpect(jsonPath("$.chain_root").doesNotExist())
                .andExpect(jsonPath("$.round_history_size").value(0))
                .andExpect(jsonPath("$.timestamp").value("2024-06-10T06:13:20Z"));
    }

    @Test
    void reportsCurrentRootAfterRound() throws Exception {
        RoundContext context = new RoundContext("BTCUSDT", 64_000.0, 0.0, 0.0, "binance",
                clock.instant(), "round_1718000000");
        String root = ledger.logRound(orchestrator.executeRound(context));

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chain_root").value(root))
                .andExpect(jsonPath("$.round_history_size").value(1))
                .andExpect(jsonPath("$.ensemble.active_clients").value(1));
    }

    @Test
    void pingAnswersOk() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
