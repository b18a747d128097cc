package com.roomdrawapp.roomdraw.ingestion.model;

import com.roomdrawapp.roomdraw.domain.room.RoomRecord;

import java.util.List;

/**
 * @param rooms null when the room list could not be loaded
 */
public record IngestedRooms(String sourceName, List<RoomRecord> rooms) {

    public static IngestedRooms unavailable(String sourceName) {
        return new IngestedRooms(sourceName, null);
    }

    public boolean available() {
        return rooms != null;
    }
}
