package com.delta.adfeed.monitor.persistence;

import com.delta.adfeed.monitor.model.AdRecord;
import com.delta.adfeed.monitor.model.UpsertOutcome;
import com.delta.adfeed.monitor.util.HashUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

// Not @Transactional: each thread has to commit on its own connection.
@SpringBootTest
@ActiveProfiles("test")
class AdJdbcRepositoryConcurrentUpsertTest {
    private static final int THREADS = 8;
    private static final int ROUNDS = 10;

    @Autowired
    private AdJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private final List<String> insertedIds = new ArrayList<>();

    @AfterEach
    void cleanUp() {
        if (!insertedIds.isEmpty()) {
            jdbc.update(
                "DELETE FROM ad_changes WHERE ad_id IN (:ids)",
                new MapSqlParameterSource().addValue("ids", insertedIds)
            );
        }
    }

    @Test
    void simultaneousSightingsOfOneAdInsertExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            for (int round = 0; round < ROUNDS; round++) {
                String url = "https://facebook.com/marketplace/item/" + UUID.randomUUID();
                String adId = HashUtils.md5Hex(url);
                insertedIds.add(adId);
                Instant base = Instant.now().truncatedTo(ChronoUnit.SECONDS).minus(Duration.ofHours(1));
                CyclicBarrier barrier = new CyclicBarrier(THREADS);

                List<Future<UpsertOutcome>> futures = new ArrayList<>();
                for (int i = 0; i < THREADS; i++) {
                    Instant seenAt = base.plusSeconds(i);
                    AdRecord sighting = new AdRecord(adId, "Sofa " + i, "$" + i, url, seenAt, seenAt);
                    futures.add(pool.submit(() -> {
                        barrier.await(10, TimeUnit.SECONDS);
                        return repository.upsert(sighting);
                    }));
                }

                int inserted = 0;
                Instant winnerSeenAt = null;
                for (int i = 0; i < THREADS; i++) {
                    UpsertOutcome outcome = futures.get(i).get(30, TimeUnit.SECONDS);
                    if (outcome == UpsertOutcome.INSERTED) {
                        inserted++;
                        winnerSeenAt = base.plusSeconds(i);
                    }
                }

                assertEquals(1, inserted, "round " + round);
                Integer rows = jdbc.queryForObject(
                    "SELECT COUNT(*) FROM ad_changes WHERE ad_id = :adId",
                    new MapSqlParameterSource().addValue("adId", adId),
                    Integer.class
                );
                assertEquals(1, rows);
                AdRecord stored = repository.findById(adId);
                assertNotNull(stored);
                assertEquals(winnerSeenAt, stored.firstSeen());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
