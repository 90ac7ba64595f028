package com.phillippitts.champ.config.ledger;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Round ledger storage.
 */
@ConfigurationProperties(prefix = "champ.ledger")
@Validated
public class LedgerProperties {

    /** Directory holding {@code <hash>.json} entries. */
    @NotBlank
    private String dataRoot = "./data/rounds";

    /** Maximum entries kept on disk; oldest are evicted first. */
    @Positive(message = "Archive cap must be positive")
    private int archiveCap = 12000;

    /** Directory entries are periodically copied to; blank disables backup. */
    private String backupRoot = "";

    /** Delay between backups. */
    @NotNull
    private Duration backupInterval = Duration.ofHours(24);

    public String getDataRoot() {
        return dataRoot;
    }

    public void setDataRoot(String dataRoot) {
        this.dataRoot = dataRoot;
    }

    public int getArchiveCap() {
        return archiveCap;
    }

    public void setArchiveCap(int archiveCap) {
        this.archiveCap = archiveCap;
    }

    public String getBackupRoot() {
        return backupRoot;
    }

    public void setBackupRoot(String backupRoot) {
        this.backupRoot = backupRoot;
    }

    public boolean hasBackupRoot() {
        return backupRoot != null && !backupRoot.isBlank();
    }

    public Duration getBackupInterval() {
        return backupInterval;
    }

    public void setBackupInterval(Duration backupInterval) {
        this.backupInterval = backupInterval;
    }
}
