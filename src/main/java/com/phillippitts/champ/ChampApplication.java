package com.phillippitts.champ;

import com.phillippitts.champ.config.alert.AlertProperties;
import com.phillippitts.champ.config.ensemble.EnsembleProperties;
import com.phillippitts.champ.config.ledger.LedgerProperties;
import com.phillippitts.champ.config.round.RoundProperties;
import com.phillippitts.champ.config.stream.StreamProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EnsembleProperties.class,
        StreamProperties.class,
        LedgerProperties.class,
        RoundProperties.class,
        AlertProperties.class
})
@EnableScheduling
public class ChampApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChampApplication.class, args);
    }

}
