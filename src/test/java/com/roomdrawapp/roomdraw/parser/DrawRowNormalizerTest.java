package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DrawRowNormalizer and Ranker Tests")
class DrawRowNormalizerTest {

    private final CsvTableParser parser = new CsvTableParser();
    private final DrawRowNormalizer normalizer = new DrawRowNormalizer();
    private final Ranker ranker = new Ranker(normalizer);

    private AnomalyLog anomalies;

    @BeforeEach
    void setUp() {
        anomalies = new AnomalyLog();
    }

    private TabularSource table(String body) {
        String text = "PUID,Draw Time,Last Name,First Name\n" + body;
        return parser.parse(text.getBytes(StandardCharsets.UTF_8), "draws.csv", DrawRowNormalizer.REQUIRED_COLUMNS);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "03/28/25 09:15 AM | 2025-03-28T09:15",
        "3/28/25 9:15 am   | 2025-03-28T09:15",
        "03/28/25 12:00 PM | 2025-03-28T12:00",
        "03/28/25 12:05 AM | 2025-03-28T00:05",
        "04/01/25 1:30 PM  | 2025-04-01T13:30"
    })
    @DisplayName("Should parse the draw time format")
    void testParseDrawTime_Valid(String input, String expected) {
        assertEquals(LocalDateTime.parse(expected), DrawRowNormalizer.parseDrawTime(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2025-03-28 09:15", "03/28/25 13:15 PM", "tomorrow", "03/28/25"})
    @DisplayName("Should reject malformed draw times")
    void testParseDrawTime_Invalid(String input) {
        assertNull(DrawRowNormalizer.parseDrawTime(input));
    }

    @Test
    @DisplayName("Should drop bad rows, keep going, and report each one")
    void testNormalize_DropsBadRows() {
        List<DrawRecord> records = normalizer.normalize(table(
                "p1,03/28/25 9:00 AM,Lee,Ann\n"
                        + "p2,not a time,Kim,Bo\n"
                        + "p3,03/28/25 9:10 AM\n"
                        + "p4,03/28/25 9:15 AM,Park,Cy\n"), anomalies);

        assertEquals(2, records.size());
        assertEquals(List.of("p1", "p4"), records.stream().map(DrawRecord::identity).toList());
        assertEquals(3, records.get(1).originIndex());
        assertEquals(1, anomalies.count(AnomalyKind.UNPARSEABLE_DRAW_TIME));
        assertEquals(1, anomalies.count(AnomalyKind.MISSING_REQUIRED_FIELD));
        assertEquals("p2", anomalies.all().get(0).row().get("PUID"));
    }

    @Test
    @DisplayName("Should drop rows with a blank first or last name and report each one")
    void testNormalize_BlankName() {
        List<DrawRecord> records = normalizer.normalize(table(
                "p1,03/28/25 9:00 AM,,\n"
                        + "p2,03/28/25 9:05 AM, ,Bo\n"
                        + "p3,03/28/25 9:10 AM,Kim,\n"
                        + "p4,03/28/25 9:15 AM,Park,Cy\n"), anomalies);

        assertEquals(List.of("p4"), records.stream().map(DrawRecord::identity).toList());
        assertEquals(3, anomalies.count(AnomalyKind.MISSING_REQUIRED_FIELD));
        assertEquals("p2", anomalies.all().get(1).row().get("PUID"));
    }

    @Test
    @DisplayName("Should keep a row with a blank identity and report it")
    void testNormalize_BlankIdentity() {
        List<DrawRecord> records = normalizer.normalize(table(" ,03/28/25 9:00 AM,Lee,Ann\n"), anomalies);

        assertEquals(1, records.size());
        assertFalse(records.get(0).hasIdentity());
        assertEquals(1, anomalies.count(AnomalyKind.MISSING_IDENTITY));
    }

    @Test
    @DisplayName("Should rank by time with input order breaking ties")
    void testRank_TieBreak() {
        Ranking ranking = ranker.rank(table(
                "late,03/28/25 10:00 AM,Z,Z\n"
                        + "tieA,03/28/25 9:00 AM,A,A\n"
                        + "early,03/27/25 4:00 PM,E,E\n"
                        + "tieB,03/28/25 9:00 AM,B,B\n"), anomalies);

        assertEquals(List.of("early", "tieA", "tieB", "late"),
                ranking.records().stream().map(DrawRecord::identity).toList());
        assertEquals("draws.csv", ranking.sourceName());
    }
}
