package com.roomdrawapp.roomdraw.domain.draw;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ranking Tests")
class RankingTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 28, 9, 0);

    @Test
    @DisplayName("Should order by draw time, then origin index, for any input order")
    void testOf_TotalOrder() {
        List<DrawRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            // four records share each slot
            records.add(new DrawRecord("id" + i, "F" + i, "L" + i, T0.plusMinutes(i / 4), "t", i));
        }

        Random random = new Random(7);
        for (int round = 0; round < 5; round++) {
            List<DrawRecord> shuffled = new ArrayList<>(records);
            Collections.shuffle(shuffled, random);

            Ranking ranking = Ranking.of("src", shuffled);

            assertEquals(records, ranking.records());
        }
    }

    @Test
    @DisplayName("Should return the first matching index for duplicate names")
    void testIndexOfName_FirstMatch() {
        Ranking ranking = Ranking.of("src", List.of(
                new DrawRecord("1", "Ann", "Lee", T0, "t", 0),
                new DrawRecord("2", "Ann", "Lee", T0.plusMinutes(1), "t", 1)
        ));

        assertEquals(0, ranking.indexOfName("ann", "LEE").orElseThrow());
        assertTrue(ranking.indexOfName("Ann", "Li").isEmpty());
    }

    @Test
    @DisplayName("Should not allow mutation of the records")
    void testRecords_Immutable() {
        Ranking ranking = Ranking.of("src", List.of(new DrawRecord("1", "Ann", "Lee", T0, "t", 0)));

        assertThrows(UnsupportedOperationException.class, () -> ranking.records().clear());
    }
}
