package com.phillippitts.champ.service.ledger;

import com.phillippitts.champ.config.ledger.LedgerProperties;
import com.phillippitts.champ.exception.LedgerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Periodically copies ledger entries to {@code champ.ledger.backup-root}. Does nothing while the
 * backup root is blank.
 */
@Component
public class LedgerBackupTask {

    private static final Logger LOG = LogManager.getLogger(LedgerBackupTask.class);

    private final ChainedRoundLog ledger;
    private final LedgerProperties properties;

    public LedgerBackupTask(ChainedRoundLog ledger, LedgerProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${champ.ledger.backup-interval:24h}",
            initialDelayString = "${champ.ledger.backup-interval:24h}")
    public void scheduledBackup() {
        backupNow();
    }

    /**
     * @return entries copied, or empty if backup is disabled or failed
     */
    public OptionalInt backupNow() {
        if (!properties.hasBackupRoot()) {
            LOG.debug("Ledger backup disabled (no backup root configured)");
            return OptionalInt.empty();
        }
        Path target = Path.of(properties.getBackupRoot()).toAbsolutePath().normalize();
        try {
            return OptionalInt.of(ledger.getArchives().backup(target));
        } catch (LedgerException e) {
            LOG.error("Ledger backup to {} failed: {}", target, e.getMessage(), e);
            return OptionalInt.empty();
        }
    }
}
