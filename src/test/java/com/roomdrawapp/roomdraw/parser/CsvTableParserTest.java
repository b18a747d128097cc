package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.common.exception.SourceLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvTableParser Tests")
class CsvTableParserTest {

    private final CsvTableParser parser = new CsvTableParser();

    private static byte[] csv(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should parse header and rows, honouring quotes")
    void testParse_Basic() {
        TabularSource t = parser.parse(csv(
                "PUID,Draw Time,Last Name,First Name\n"
                        + "p1,03/28/25 9:00 AM,\"O'Neil, Jr\",Ann\n"
                        + "\n"
                        + "p2,03/28/25 9:05 AM,\"Say \"\"Hi\"\"\",Bo\n"),
                "draws.csv", DrawRowNormalizer.REQUIRED_COLUMNS);

        assertEquals("draws.csv", t.sourceName());
        assertEquals(2, t.rows().size());
        assertEquals("O'Neil, Jr", t.value(t.rows().get(0), "last name"));
        assertEquals("Say \"Hi\"", t.value(t.rows().get(1), "Last Name"));
    }

    @Test
    @DisplayName("Should strip a UTF-8 byte order mark from the header")
    void testParse_Bom() {
        TabularSource t = parser.parse(csv("\uFEFFPUID,Draw Time,Last Name,First Name\np1,03/28/25 9:00 AM,Lee,Ann\n"),
                "draws.csv", DrawRowNormalizer.REQUIRED_COLUMNS);

        assertTrue(t.hasColumn("PUID"));
        assertEquals("p1", t.value(t.rows().get(0), "PUID"));
    }

    @Test
    @DisplayName("Should reject a table missing required columns")
    void testParse_MissingColumns() {
        SourceLoadException ex = assertThrows(SourceLoadException.class, () -> parser.parse(
                csv("PUID,Last Name,First Name\np1,Lee,Ann\n"), "draws.csv", DrawRowNormalizer.REQUIRED_COLUMNS));

        assertEquals("draws.csv", ex.getSourceName());
        assertTrue(ex.getMessage().contains("Draw Time"));
    }

    @Test
    @DisplayName("Should reject empty content")
    void testParse_Empty() {
        assertThrows(SourceLoadException.class, () -> parser.parse(new byte[0], "x.csv", List.of()));
        assertThrows(SourceLoadException.class, () -> parser.parse(csv("\n\n"), "x.csv", List.of()));
    }

    @Test
    @DisplayName("Should leave cells past the end of a short row absent")
    void testParse_ShortRow() {
        TabularSource t = parser.parse(csv("A,B,C\n1,2\n"), "x.csv", List.of("A"));

        assertEquals("2", t.value(t.rows().get(0), "B"));
        assertNull(t.value(t.rows().get(0), "C"));
    }

    @Test
    @DisplayName("Should treat each physical line as a row even inside quotes")
    void testParse_MultilineQuotedCell() {
        TabularSource t = parser.parse(csv("A,B\n\"one\ntwo\",x\n"), "x.csv", List.of("A"));

        assertEquals(2, t.rows().size());
        assertEquals("one", t.value(t.rows().get(0), "A"));
        assertNull(t.value(t.rows().get(0), "B"));
        // the closing quote reopens quoting on the second line
        assertEquals("two,x", t.value(t.rows().get(1), "A"));
        assertNull(t.value(t.rows().get(1), "B"));
    }
}
