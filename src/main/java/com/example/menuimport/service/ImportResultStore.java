package com.example.menuimport.service;

import com.example.menuimport.model.ImportResult;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Holds finished run results in memory until the caller collects them. Entries expire after the
 * configured retention.
 */
@Slf4j
@Component
public class ImportResultStore {

    private final Map<String, StoredResult> results = new ConcurrentHashMap<>();
    private final Duration retention;

    public ImportResultStore(@Value("${app.import.result-retention-hours:24}") long retentionHours) {
        this.retention = Duration.ofHours(Math.max(1, retentionHours));
    }

    public void put(String jobId, ImportResult result) {
        results.put(jobId, new StoredResult(result, Instant.now()));
    }

    public Optional<ImportResult> get(String jobId) {
        StoredResult stored = results.get(jobId);
        return stored == null ? Optional.empty() : Optional.of(stored.result());
    }

    public void remove(String jobId) {
        results.remove(jobId);
    }

    @Scheduled(cron = "${app.import.result-cleanup-cron:0 0 * * * *}")
    public void evictExpired() {
        Instant cutoff = Instant.now().minus(retention);
        int before = results.size();
        results.values().removeIf(stored -> stored.storedAt().isBefore(cutoff));
        int evicted = before - results.size();
        if (evicted > 0) {
            log.info("Evicted {} expired import results", evicted);
        }
    }

    private record StoredResult(ImportResult result, Instant storedAt) {
    }
}
