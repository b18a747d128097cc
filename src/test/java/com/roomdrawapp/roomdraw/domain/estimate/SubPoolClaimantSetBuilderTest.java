package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.TestDraws;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SubPoolClaimantSetBuilder Tests")
class SubPoolClaimantSetBuilderTest {

    private AnomalyLog anomalies;

    @BeforeEach
    void setUp() {
        anomalies = new AnomalyLog();
    }

    @Test
    @DisplayName("Should take the first K identities of the unit ranking")
    void testBuild_TopK() {
        Ranking unit = TestDraws.ranking("spelman.csv", "A", "F", "G");

        ClaimantSet set = SubPoolClaimantSetBuilder.build(unit, 2, anomalies);

        assertEquals(Set.of("A", "F"), set.identities());
        assertEquals(SubPoolClaimantSetBuilder.LABEL, set.label());
    }

    @Test
    @DisplayName("Should return the whole ranking when capacity exceeds its length")
    void testBuild_CapacityLargerThanRanking() {
        Ranking unit = TestDraws.ranking("spelman.csv", "A", "F");

        ClaimantSet set = SubPoolClaimantSetBuilder.build(unit, 40, anomalies);

        assertEquals(Set.of("A", "F"), set.identities());
        assertTrue(anomalies.isEmpty());
    }

    @Test
    @DisplayName("Should return an empty set and report when capacity is not positive")
    void testBuild_NonPositiveCapacity() {
        Ranking unit = TestDraws.ranking("spelman.csv", "A", "F");

        assertTrue(SubPoolClaimantSetBuilder.build(unit, 0, anomalies).isEmpty());
        assertTrue(SubPoolClaimantSetBuilder.build(unit, -3, anomalies).isEmpty());
        assertEquals(2, anomalies.count(AnomalyKind.NON_POSITIVE_CAPACITY));
    }

    @Test
    @DisplayName("Should return an empty set when no unit ranking is loaded")
    void testBuild_NoRanking() {
        assertTrue(SubPoolClaimantSetBuilder.build(null, 5, anomalies).isEmpty());
    }

    @Test
    @DisplayName("Should skip rows without identity without using up a slot")
    void testBuild_MissingIdentity() {
        LocalDateTime t = LocalDateTime.of(2025, 3, 28, 9, 0);
        Ranking unit = Ranking.of("spelman.csv", List.of(
                new DrawRecord(null, "No", "Id", t, "t0", 0),
                new DrawRecord("A", "A", "Drawer", t.plusMinutes(1), "t1", 1),
                new DrawRecord("F", "F", "Drawer", t.plusMinutes(2), "t2", 2)
        ));

        ClaimantSet set = SubPoolClaimantSetBuilder.build(unit, 2, anomalies);

        assertEquals(Set.of("A", "F"), set.identities());
        assertEquals(1, anomalies.count(AnomalyKind.MISSING_IDENTITY));
    }
}
