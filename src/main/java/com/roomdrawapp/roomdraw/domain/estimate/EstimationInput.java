package com.roomdrawapp.roomdraw.domain.estimate;

import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import com.roomdrawapp.roomdraw.domain.room.RoomRecord;
import lombok.Builder;

import java.util.List;

/**
 * Everything one run needs, already loaded. Null {@code rooms} or {@code unitRanking} means that
 * source was unavailable; null entries in {@code crossPools} are pools that failed to load.
 */
@Builder
public record EstimationInput(
        Ranking primary,
        List<RoomRecord> rooms,
        String roomsSourceName,
        Ranking unitRanking,
        List<Ranking> crossPools,
        String firstName,
        String lastName
) {}
