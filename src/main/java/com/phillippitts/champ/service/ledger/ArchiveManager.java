package com.phillippitts.champ.service.ledger;

import com.phillippitts.champ.exception.LedgerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Read side of the ledger directory: lists entries in write order, reads them back and copies them
 * to a backup location.
 *
 * <p>Write order is modification time ascending, ties broken by file name. {@link ChainedRoundLog}
 * stamps strictly increasing modification times so the order is exact for entries it wrote.
 */
public class ArchiveManager {

    private static final Logger LOG = LogManager.getLogger(ArchiveManager.class);
    static final String ENTRY_SUFFIX = ".json";

    private final Path root;

    public ArchiveManager(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return persisted entries, oldest first; empty if the directory does not exist yet
     */
    public List<Path> listArchives() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(root)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(file) && file.getFileName().toString().endsWith(ENTRY_SUFFIX)) {
                    entries.add(new Entry(file, Files.getLastModifiedTime(file)));
                }
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to list ledger entries", root, e);
        }
        entries.sort(Comparator.comparing(Entry::modified)
                .thenComparing(e -> e.path().getFileName().toString()));
        return entries.stream().map(Entry::path).toList();
    }

    /**
     * @return entry bytes, oldest first, suitable for {@link ChainedRoundLog#replay(Iterable)}
     */
    public List<byte[]> readInWriteOrder() {
        List<byte[]> contents = new ArrayList<>();
        for (Path entry : listArchives()) {
            try {
                contents.add(Files.readAllBytes(entry));
            } catch (IOException e) {
                throw new LedgerException("Failed to read ledger entry", entry, e);
            }
        }
        return contents;
    }

    /**
     * Copies every entry into {@code target}, preserving modification times. Existing files with the
     * same name are replaced.
     *
     * @return number of entries copied
     */
    public int backup(Path target) {
        Objects.requireNonNull(target, "target");
        try {
            Files.createDirectories(target);
        } catch (IOException e) {
            throw new LedgerException("Failed to create backup directory", target, e);
        }
        int copied = 0;
        for (Path entry : listArchives()) {
            Path destination = target.resolve(entry.getFileName().toString());
            try {
                Files.copy(entry, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                copied++;
            } catch (IOException e) {
                throw new LedgerException("Failed to back up ledger entry", destination, e);
            }
        }
        LOG.info("Backed up {} ledger entries from {} to {}", copied, root, target);
        return copied;
    }

    private record Entry(Path path, FileTime modified) {}
}
