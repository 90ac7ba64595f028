package com.phillippitts.champ.service.ledger;

import com.phillippitts.champ.domain.RoundRecord;
import com.phillippitts.champ.exception.LedgerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only round ledger with a running hash chain.
 *
 * <p><b>Write:</b> the record is serialized with {@link CanonicalJson}, its SHA-256 becomes the entry
 * name ({@code <hash>.json}) and the new root is {@code sha256(previousRoot + contentHash)} over the
 * hex strings, starting from an empty root. The root only advances once the entry is on disk; a
 * failed write throws {@link LedgerException} and leaves the root untouched.
 *
 * <p><b>Retention:</b> after each write the oldest entries are deleted until at most
 * {@code archiveCap} remain. Pruning never changes the root.
 *
 * <p><b>Thread Model:</b> single writer. {@link #logRound} is serialized on the instance lock.
 */
public class ChainedRoundLog {

    private static final Logger LOG = LogManager.getLogger(ChainedRoundLog.class);

    private final Path dataRoot;
    private final int archiveCap;
    private final Clock clock;
    private final ArchiveManager archives;

    private String currentRoot = "";
    private long lastStampMillis = Long.MIN_VALUE;

    public ChainedRoundLog(Path dataRoot, int archiveCap, Clock clock) {
        this.dataRoot = Objects.requireNonNull(dataRoot, "dataRoot");
        if (archiveCap <= 0) {
            throw new IllegalArgumentException("archiveCap must be positive, got: " + archiveCap);
        }
        this.archiveCap = archiveCap;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.archives = new ArchiveManager(dataRoot);
        try {
            Files.createDirectories(dataRoot);
        } catch (IOException e) {
            throw new LedgerException("Failed to create ledger directory", dataRoot, e);
        }
    }

    /**
     * Persists the record and advances the chain.
     *
     * @return the new root (64 hex chars)
     * @throws LedgerException if the entry cannot be written
     */
    public synchronized String logRound(RoundRecord record) {
        Objects.requireNonNull(record, "record");
        byte[] content = CanonicalJson.toBytes(record);
        String contentHash = Sha256.hex(content);
        Path entry = dataRoot.resolve(contentHash + ArchiveManager.ENTRY_SUFFIX);
        boolean existed = Files.exists(entry);
        try {
            Files.write(entry, content);
        } catch (IOException e) {
            throw new LedgerException("Failed to persist round " + record.roundId(), entry, e);
        }
        try {
            stamp(entry, nextStamp());
        } catch (IOException e) {
            if (!existed) {
                discard(entry);
            }
            throw new LedgerException("Failed to stamp round " + record.roundId(), entry, e);
        }
        currentRoot = combine(currentRoot, contentHash);
        LOG.info("Logged round {} as {}; root={}", record.roundId(), entry.getFileName(), currentRoot);
        prune();
        return currentRoot;
    }

    /**
     * @return the latest root, or empty if nothing has been logged by this instance
     */
    public synchronized Optional<String> getCurrentRoot() {
        return currentRoot.isEmpty() ? Optional.empty() : Optional.of(currentRoot);
    }

    public ArchiveManager getArchives() {
        return archives;
    }

    /**
     * Re-derives the root from serialized entries in write order.
     *
     * @return the root after the last entry, or empty for no entries
     */
    public static Optional<String> replay(Iterable<byte[]> entries) {
        String root = "";
        for (byte[] entry : entries) {
            root = combine(root, Sha256.hex(entry));
        }
        return root.isEmpty() ? Optional.empty() : Optional.of(root);
    }

    static String combine(String previousRoot, String contentHash) {
        return Sha256.hex(previousRoot + contentHash);
    }

    private long nextStamp() {
        long now = clock.millis();
        lastStampMillis = now > lastStampMillis ? now : lastStampMillis + 1;
        return lastStampMillis;
    }

    void stamp(Path entry, long millis) throws IOException {
        Files.setLastModifiedTime(entry, FileTime.fromMillis(millis));
    }

    // an unstamped entry would break write-order replay
    private void discard(Path entry) {
        try {
            Files.deleteIfExists(entry);
        } catch (IOException e) {
            LOG.warn("Failed to remove unstamped ledger entry {}: {}", entry, e.getMessage());
        }
    }

    private void prune() {
        List<Path> entries;
        try {
            entries = archives.listArchives();
        } catch (LedgerException e) {
            LOG.warn("Skipping eviction: {}", e.getMessage());
            return;
        }
        int excess = entries.size() - archiveCap;
        for (int i = 0; i < excess; i++) {
            Path oldest = entries.get(i);
            try {
                Files.deleteIfExists(oldest);
                LOG.debug("Evicted ledger entry {}", oldest.getFileName());
            } catch (IOException e) {
                LOG.warn("Failed to evict ledger entry {}: {}", oldest, e.getMessage());
            }
        }
    }
}
