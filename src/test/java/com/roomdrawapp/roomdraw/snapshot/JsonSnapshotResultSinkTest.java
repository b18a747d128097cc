package com.roomdrawapp.roomdraw.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.estimate.ChanceRating;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationResult;
import com.roomdrawapp.roomdraw.domain.estimate.RankBasis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonSnapshotResultSink Tests")
class JsonSnapshotResultSinkTest {

    @TempDir
    Path dir;

    private static EstimationResult result() {
        return EstimationResult.builder()
                .displayName("Dee Davis")
                .identity("u4")
                .drawTime("03/28/25 9:15 AM")
                .rawRank(4)
                .rankingSize(5)
                .initialAhead(3)
                .removedBySubPool(1)
                .subPoolCapacity(1)
                .removedByCrossPool(1)
                .crossPoolTopN(50)
                .totalRemoved(2)
                .filteredAhead(1)
                .competitorRank(2)
                .rankBasis(RankBasis.RANK_AMONG_COMPETITORS)
                .availableScarceSpots(2)
                .probabilityPercent(100)
                .chanceRating(ChanceRating.EXCELLENT)
                .remainingAhead(List.of())
                .generatedAt(Instant.parse("2025-03-20T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should write the dashboard field names")
    void testPublish_WritesSnapshot() throws Exception {
        Path out = dir.resolve("public/dashboard-data.json");
        JsonSnapshotResultSink sink = new JsonSnapshotResultSink(true, out.toString());
        AnomalyLog anomalies = new AnomalyLog();

        sink.publish(result(), anomalies);

        JsonNode json = new ObjectMapper().readTree(Files.readString(out));
        assertEquals("Dee Davis", json.get("userName").asText());
        assertEquals("u4", json.get("puid").asText());
        assertEquals(4, json.get("rawPosition").asInt());
        assertEquals(1, json.get("removedSpelman").asInt());
        assertEquals(1, json.get("spelmanCapacity").asInt());
        assertEquals(1, json.get("removedOtherRes").asInt());
        assertEquals(50, json.get("otherResTopN").asInt());
        assertEquals(1, json.get("finalPositionEstimate").asInt());
        assertEquals(2, json.get("availableSingles").asInt());
        assertEquals(100, json.get("probabilitySingle").asInt());
        assertEquals("2025-03-20T12:00:00Z", json.get("lastUpdated").asText());
        assertEquals("EXCELLENT", json.get("chanceRating").asText());
        assertTrue(anomalies.isEmpty());
        assertEquals(List.of(out), listing(out.getParent()));
    }

    private static List<Path> listing(Path folder) throws Exception {
        try (Stream<Path> files = Files.list(folder)) {
            return files.toList();
        }
    }

    @Test
    @DisplayName("Should leave one complete snapshot after concurrent publishes")
    void testPublish_Concurrent() throws Exception {
        Path out = dir.resolve("public/dashboard-data.json");
        JsonSnapshotResultSink sink = new JsonSnapshotResultSink(true, out.toString());
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        try {
            List<Future<AnomalyLog>> runs = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Callable<AnomalyLog> run = () -> {
                    AnomalyLog anomalies = new AnomalyLog();
                    start.await();
                    for (int i = 0; i < 20; i++) sink.publish(result(), anomalies);
                    return anomalies;
                };
                runs.add(pool.submit(run));
            }
            start.countDown();

            for (Future<AnomalyLog> run : runs) {
                assertTrue(run.get(30, TimeUnit.SECONDS).isEmpty());
            }
        } finally {
            pool.shutdownNow();
        }

        JsonNode json = new ObjectMapper().readTree(Files.readString(out));
        assertEquals("u4", json.get("puid").asText());
        assertEquals(List.of(out), listing(out.getParent()));
    }

    @Test
    @DisplayName("Should do nothing when disabled")
    void testPublish_Disabled() {
        Path out = dir.resolve("dashboard-data.json");
        new JsonSnapshotResultSink(false, out.toString()).publish(result(), new AnomalyLog());

        assertFalse(Files.exists(out));
    }

    @Test
    @DisplayName("Should report, not throw, when the snapshot cannot be written")
    void testPublish_Unwritable() throws Exception {
        Path blocker = Files.writeString(dir.resolve("not-a-dir"), "x");
        JsonSnapshotResultSink sink = new JsonSnapshotResultSink(true, blocker.resolve("dashboard-data.json").toString());
        AnomalyLog anomalies = new AnomalyLog();

        assertDoesNotThrow(() -> sink.publish(result(), anomalies));
        assertEquals(1, anomalies.count(AnomalyKind.SNAPSHOT_NOT_WRITTEN));
    }
}
