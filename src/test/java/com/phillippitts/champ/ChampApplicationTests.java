package com.phillippitts.champ;

import com.phillippitts.champ.service.ensemble.EnsembleOrchestrator;
import com.phillippitts.champ.service.stream.StreamManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ChampApplicationTests {

    @Autowired
    private EnsembleOrchestrator orchestrator;

    @Autowired
    private StreamManager streamManager;

    @Test
    void contextLoads() {
        assertThat(orchestrator.getClients()).extracting("name").containsExactly("test_model");
        assertThat(streamManager.isRunning()).isFalse();
    }
}
