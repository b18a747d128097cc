package com.roomdrawapp.roomdraw.domain.room;

import java.util.Locale;

/**
 * One available room. {@code occupancyType} is kept as the normalized code (trimmed, upper-cased)
 * so unknown codes survive until capacity resolution reports them.
 */
public record RoomRecord(String group, String unit, String roomId, String occupancyType) {

    public RoomRecord {
        group = group == null ? "" : group.trim();
        unit = unit == null ? "" : unit.trim();
        roomId = roomId == null ? "" : roomId.trim();
        occupancyType = occupancyType == null ? "" : occupancyType.trim().toUpperCase(Locale.ROOT);
    }

    public boolean inGroup(String g) {
        return g != null && group.equalsIgnoreCase(g.trim());
    }

    public boolean inUnit(String g, String u) {
        return inGroup(g) && u != null && unit.equalsIgnoreCase(u.trim());
    }
}
