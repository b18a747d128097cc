package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.room.RoomRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public final class CapacityResolver {

    private CapacityResolver() {}

    /**
     * Sums the spots of the policy's scarce unit and counts scarce-type rooms across its group.
     *
     * Rules:
     * - Unit match is group + unit, both trimmed and case-insensitive.
     * - Unknown occupancy codes add 0 spots and are reported; the room still counts as listed.
     * - The scarce-type count ignores the unit: every matching room in the group counts once.
     * - A null room list means the room source was unavailable: all zero, never throws.
     */
    public static CapacitySummary resolve(List<RoomRecord> rooms, EstimationPolicy policy, String sourceName, AnomalyLog anomalies) {
        if (rooms == null) {
            log.info("No room data; capacity-gated exclusion is inactive");
            return CapacitySummary.unavailable();
        }

        int capacity = 0;
        int unitRooms = 0;
        int scarceSpots = 0;

        for (RoomRecord room : rooms) {
            if (room.inUnit(policy.scarceGroup(), policy.scarceUnit())) {
                unitRooms++;
                Optional<Integer> spots = policy.spotsFor(room.occupancyType());
                if (spots.isPresent()) {
                    capacity += spots.get();
                } else {
                    anomalies.report(
                            AnomalyKind.UNKNOWN_OCCUPANCY_TYPE,
                            sourceName,
                            "Unknown room type '" + room.occupancyType() + "' for " + policy.scarceUnit()
                                    + " room " + room.roomId() + "; assuming 0 capacity",
                            snapshot(room)
                    );
                }
            }

            if (room.inGroup(policy.scarceGroup()) && policy.isScarceType(room.occupancyType())) {
                scarceSpots++;
            }
        }

        log.info("Found {} rooms in {} {} with capacity {}; {} {} rooms across {}",
                unitRooms, policy.scarceGroup(), policy.scarceUnit(), capacity,
                scarceSpots, policy.scarceOccupancyType(), policy.scarceGroup());

        return new CapacitySummary(capacity, unitRooms, scarceSpots, true);
    }

    private static Map<String, String> snapshot(RoomRecord room) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("group", room.group());
        m.put("unit", room.unit());
        m.put("room", room.roomId());
        m.put("type", room.occupancyType());
        return m;
    }
}
