package com.roomdrawapp.roomdraw.domain.estimate;

/**
 * @param unitCapacity       summed spots of the rooms in the scarce unit
 * @param unitRoomCount      rooms listed in the scarce unit, unknown types included
 * @param scarceSpotCount    rooms of the scarce occupancy type anywhere in the group
 * @param roomDataAvailable  false when no room list was loaded; capacity-gated exclusion is then inactive
 */
public record CapacitySummary(int unitCapacity, int unitRoomCount, int scarceSpotCount, boolean roomDataAvailable) {

    public static CapacitySummary unavailable() {
        return new CapacitySummary(0, 0, 0, false);
    }
}
