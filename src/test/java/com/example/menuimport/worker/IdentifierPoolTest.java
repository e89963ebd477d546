package com.example.menuimport.worker;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IdentifierPoolTest {

    @Test
    void issuesUniqueIdsAcrossRefills() {
        IdentifierPool pool = new IdentifierPool(10);
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 95; i++) {
            ids.add(pool.get());
        }
        assertThat(ids).hasSize(95);
        assertThat(ids).allSatisfy(id -> assertThat(UUID.fromString(id)).isNotNull());
    }

    @Test
    void refillsInFixedSizeBatches() {
        AtomicInteger generated = new AtomicInteger();
        IdentifierPool pool = new IdentifierPool(5, () -> {
            generated.incrementAndGet();
            return UUID.randomUUID();
        }, 1L);

        pool.get();
        assertThat(generated).hasValue(5);
        assertThat(pool.available()).isEqualTo(4);

        for (int i = 0; i < 4; i++) {
            pool.get();
        }
        assertThat(generated).hasValue(5);

        pool.get();
        assertThat(generated).hasValue(10);
    }

    @Test
    void fallsBackToCounterIdsWhenRandomSourceFails() {
        IdentifierPool pool = new IdentifierPool(3, () -> {
            throw new IllegalStateException("entropy unavailable");
        }, 1700000000000L);

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 7; i++) {
            ids.add(pool.get());
        }

        assertThat(ids).hasSize(7);
        assertThat(ids).allSatisfy(id -> assertThat(id).startsWith("local-1700000000000-"));
    }
}
