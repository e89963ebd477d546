package com.example.menuimport.worker;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch-refilled supply of unique ids for one run.
 *
 * <p>Ids are random (type 4) UUIDs, drawn from {@link java.security.SecureRandom}. If that source
 * fails the pool switches to {@code local-<runStartMillis>-<counter>} ids for the rest of the run.
 * The prefix keeps fallback ids disjoint from UUID text and the counter keeps them disjoint from
 * each other.
 */
@Slf4j
public class IdentifierPool {

    static final String FALLBACK_PREFIX = "local-";

    private final Deque<String> buffer;
    private final int batchSize;
    private final Supplier<UUID> randomSource;
    private final long runStartMillis;

    private boolean fallbackActive;
    private long fallbackCounter;

    public IdentifierPool(int batchSize) {
        this(batchSize, UUID::randomUUID, System.currentTimeMillis());
    }

    IdentifierPool(int batchSize, Supplier<UUID> randomSource, long runStartMillis) {
        this.batchSize = Math.max(1, batchSize);
        this.buffer = new ArrayDeque<>(this.batchSize);
        this.randomSource = randomSource;
        this.runStartMillis = runStartMillis;
    }

    public String get() {
        if (buffer.isEmpty()) {
            refill();
        }
        return buffer.pop();
    }

    int available() {
        return buffer.size();
    }

    private void refill() {
        for (int i = 0; i < batchSize; i++) {
            buffer.push(nextId());
        }
    }

    private String nextId() {
        if (!fallbackActive) {
            try {
                return randomSource.get().toString();
            } catch (RuntimeException ex) {
                fallbackActive = true;
                log.warn("Secure random id source unavailable, switching to counter ids: {}", ex.getMessage());
            }
        }
        fallbackCounter++;
        return FALLBACK_PREFIX + runStartMillis + "-" + fallbackCounter;
    }
}
