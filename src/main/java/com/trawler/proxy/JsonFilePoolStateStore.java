package com.trawler.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trawler.exception.PoolStatePersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps pool snapshots as {@code proxy_state_<timestamp>.json} files. Each save writes a temp file
 * and moves it into place, so a crash mid-write never leaves a truncated snapshot behind.
 */
@Slf4j
public class JsonFilePoolStateStore implements PoolStateStore {

    static final String PREFIX = "proxy_state_";
    static final String SUFFIX = ".json";
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private static final Comparator<Path> NEWEST_FIRST = Comparator
            .comparing(JsonFilePoolStateStore::modifiedTime)
            .thenComparing(p -> p.getFileName().toString())
            .reversed();

    private final Path stateDir;
    private final ObjectMapper objectMapper;
    private final int retainedSnapshots;
    private final Clock clock;

    public JsonFilePoolStateStore(Path stateDir, ObjectMapper objectMapper, int retainedSnapshots, Clock clock) {
        if (retainedSnapshots < 1) {
            throw new IllegalArgumentException("At least one snapshot must be retained");
        }
        this.stateDir = stateDir;
        this.objectMapper = objectMapper;
        this.retainedSnapshots = retainedSnapshots;
        this.clock = clock;
    }

    @Override
    public void save(PoolSnapshot snapshot) {
        Instant stamp = snapshot.timestamp() == null ? clock.instant() : snapshot.timestamp();
        Path target = stateDir.resolve(PREFIX + STAMP.format(stamp) + SUFFIX);
        Path temp = null;
        try {
            Files.createDirectories(stateDir);
            temp = Files.createTempFile(stateDir, PREFIX, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            moveIntoPlace(temp, target);
            log.debug("Saved pool snapshot {} ({} working, {} blacklisted)", target.getFileName(),
                    snapshot.workingProxies().size(), snapshot.blacklistedProxies().size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PoolStatePersistenceException(target, "Failed to write pool snapshot", e);
        }
        prune();
    }

    /**
     * Age is measured from the harvest recorded in the snapshot, so blacklist and shutdown writes do
     * not extend the life of an old pool. Snapshots without a harvest time fall back to the file's
     * modification time.
     */
    @Override
    public Optional<PoolSnapshot> loadLatest(Duration maxAge) {
        Optional<Path> newest = snapshotFiles().stream().findFirst();
        if (newest.isEmpty()) {
            log.info("No cached proxy state found in {}", stateDir);
            return Optional.empty();
        }

        Path file = newest.get();
        PoolSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(file.toFile(), PoolSnapshot.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable proxy state {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }

        Instant harvestedAt = snapshot.generatedAt() != null
                ? snapshot.generatedAt()
                : modifiedTime(file).toInstant();
        Duration age = Duration.between(harvestedAt, clock.instant());
        if (age.compareTo(maxAge) > 0) {
            log.info("Cached proxy state {} holds a harvest older than {} ({}h old)",
                    file.getFileName(), maxAge, age.toHours());
            return Optional.empty();
        }

        log.info("Loaded {} working and {} blacklisted proxies from {}",
                snapshot.workingProxies().size(), snapshot.blacklistedProxies().size(), file.getFileName());
        return Optional.of(snapshot);
    }

    List<Path> snapshotFiles() {
        if (!Files.isDirectory(stateDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(stateDir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(PREFIX) && name.endsWith(SUFFIX);
                    })
                    .sorted(NEWEST_FIRST)
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list proxy state directory {}: {}", stateDir, e.getMessage());
            return List.of();
        }
    }

    private void prune() {
        List<Path> files = snapshotFiles();
        for (Path old : files.subList(Math.min(retainedSnapshots, files.size()), files.size())) {
            try {
                Files.deleteIfExists(old);
            } catch (IOException e) {
                log.warn("Could not prune old proxy state {}: {}", old.getFileName(), e.getMessage());
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not delete temp snapshot {}: {}", temp, e.getMessage());
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
