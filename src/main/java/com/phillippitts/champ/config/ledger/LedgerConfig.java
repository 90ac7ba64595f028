package com.phillippitts.champ.config.ledger;

import com.phillippitts.champ.service.ledger.ChainedRoundLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class LedgerConfig {

    private static final Logger LOG = LogManager.getLogger(LedgerConfig.class);

    @Bean
    public ChainedRoundLog chainedRoundLog(LedgerProperties properties, Clock clock) {
        Path dataRoot = Path.of(properties.getDataRoot()).toAbsolutePath().normalize();
        LOG.info("Round ledger at {} (archive cap {})", dataRoot, properties.getArchiveCap());
        return new ChainedRoundLog(dataRoot, properties.getArchiveCap(), clock);
    }
}
