package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.room.RoomRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class RoomRowNormalizer {

    public static final String COL_GROUP = "College";
    public static final String COL_UNIT = "Dorm";
    public static final String COL_ROOM = "Room";
    public static final String COL_TYPE = "Type";

    // Sq Foot and Independent are not used
    public static final List<String> REQUIRED_COLUMNS = List.of(COL_GROUP, COL_UNIT, COL_ROOM, COL_TYPE);

    /**
     * Rows missing group or unit cannot be placed and are dropped; an unknown or blank type is kept
     * so capacity resolution can report it.
     */
    public List<RoomRecord> normalize(TabularSource source, AnomalyLog anomalies) {
        List<RoomRecord> out = new ArrayList<>();
        for (Map<String, String> row : source.rows()) {
            String group = source.value(row, COL_GROUP);
            String unit = source.value(row, COL_UNIT);
            if (group == null || unit == null) {
                anomalies.report(AnomalyKind.MISSING_REQUIRED_FIELD, source.sourceName(),
                        "Room row is missing " + (group == null ? COL_GROUP : COL_UNIT) + "; skipping row", row);
                continue;
            }
            out.add(new RoomRecord(group, unit, source.value(row, COL_ROOM), source.value(row, COL_TYPE)));
        }
        return out;
    }
}
