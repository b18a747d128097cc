package com.roomdrawapp.roomdraw.domain;

import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for draw records in tests. Identity doubles as first name; last name is "Drawer".
 */
public final class TestDraws {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 3, 28, 9, 0);

    private TestDraws() {}

    public static DrawRecord record(String id, int minuteOffset, int originIndex) {
        LocalDateTime t = BASE.plusMinutes(minuteOffset);
        return new DrawRecord(id, id, "Drawer", t, t.toString(), originIndex);
    }

    /** Ranking whose order equals the argument order, five minutes apart. */
    public static Ranking ranking(String source, String... ids) {
        List<DrawRecord> out = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            out.add(record(ids[i], i * 5, i));
        }
        return Ranking.of(source, out);
    }
}
