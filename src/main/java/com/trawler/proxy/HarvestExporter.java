package com.trawler.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes each harvest as {@code working_proxies_<country>_<timestamp>.json} next to the pool
 * snapshots, for tools that consume the raw harvest rather than the live pool.
 */
@Slf4j
public class HarvestExporter {

    static final String PREFIX = "working_proxies_";
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path exportDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HarvestExporter(Path exportDir, ObjectMapper objectMapper, Clock clock) {
        this.exportDir = exportDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param countryFilter the filter the harvest ran with, {@code null} or ALL when unfiltered
     * @return the written file, empty when there was nothing to export or the write failed
     */
    public Optional<Path> export(List<ProxyRecord> proxies, String countryFilter) {
        if (proxies == null || proxies.isEmpty()) {
            log.warn("No proxies to export");
            return Optional.empty();
        }

        Instant now = clock.instant();
        String country = countryFilter == null || countryFilter.isBlank()
                ? "all"
                : countryFilter.toLowerCase(Locale.ROOT);
        Path target = exportDir.resolve(PREFIX + country + "_" + STAMP.format(now) + ".json");
        HarvestExport export = new HarvestExport(proxies, List.of(), now, now, country.toUpperCase(Locale.ROOT));

        Path temp = null;
        try {
            Files.createDirectories(exportDir);
            temp = Files.createTempFile(exportDir, PREFIX, ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), export);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Exported {} working proxies to {}", proxies.size(), target);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Failed to export harvest to {}: {}", target, e.getMessage());
            deleteTemp(temp);
            return Optional.empty();
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not delete temp export {}: {}", temp, e.getMessage());
        }
    }

    record HarvestExport(
            @JsonProperty("working_proxies") List<ProxyRecord> workingProxies,
            @JsonProperty("blacklisted_proxies") List<ProxyRecord> blacklistedProxies,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("generated_at") Instant generatedAt,
            @JsonProperty("country_filter") String countryFilter
    ) {
    }
}
