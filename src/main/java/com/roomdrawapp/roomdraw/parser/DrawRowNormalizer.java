package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns draw-list rows into {@link DrawRecord}s. Bad rows are dropped and reported, never fatal.
 */
@Component
public class DrawRowNormalizer {

    public static final String COL_IDENTITY = "PUID";
    public static final String COL_DRAW_TIME = "Draw Time";
    public static final String COL_LAST_NAME = "Last Name";
    public static final String COL_FIRST_NAME = "First Name";

    public static final List<String> REQUIRED_COLUMNS = List.of(COL_IDENTITY, COL_DRAW_TIME, COL_LAST_NAME, COL_FIRST_NAME);

    // 03/28/25 9:15 AM
    static final DateTimeFormatter DRAW_TIME_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("M/d/yy h:mm a")
            .toFormatter(Locale.US);

    public List<DrawRecord> normalize(TabularSource source, AnomalyLog anomalies) {
        List<DrawRecord> out = new ArrayList<>();
        List<Map<String, String>> rows = source.rows();

        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);

            String identity = source.value(row, COL_IDENTITY);
            String first = source.value(row, COL_FIRST_NAME);
            String last = source.value(row, COL_LAST_NAME);
            String time = source.value(row, COL_DRAW_TIME);

            if (identity == null || first == null || last == null || time == null) {
                anomalies.report(AnomalyKind.MISSING_REQUIRED_FIELD, source.sourceName(),
                        "Row " + i + " is missing a required cell; skipping row", row);
                continue;
            }

            if (first.isBlank() || last.isBlank()) {
                anomalies.report(AnomalyKind.MISSING_REQUIRED_FIELD, source.sourceName(),
                        "Row " + i + " has a blank name; skipping row", row);
                continue;
            }

            LocalDateTime drawTime = parseDrawTime(time);
            if (drawTime == null) {
                anomalies.report(AnomalyKind.UNPARSEABLE_DRAW_TIME, source.sourceName(),
                        "Could not parse draw time '" + time + "'; skipping row", row);
                continue;
            }

            String id = identity.isBlank() ? null : identity.trim();
            if (id == null) {
                anomalies.report(AnomalyKind.MISSING_IDENTITY, source.sourceName(),
                        "Row " + i + " has a blank " + COL_IDENTITY + "; kept but cannot be filtered", row);
            }

            out.add(new DrawRecord(id, first, last, drawTime, time.trim(), i));
        }

        return out;
    }

    static LocalDateTime parseDrawTime(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return LocalDateTime.parse(s.trim().replaceAll("\\s+", " "), DRAW_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
