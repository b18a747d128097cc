package com.roomdrawapp.roomdraw.ingestion.model;

import com.roomdrawapp.roomdraw.domain.draw.Ranking;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the estimation core reads, loaded upfront.
 *
 * @param unitRanking null when the scarce unit's own list could not be loaded
 * @param crossPools  successfully loaded parallel pools, in request order
 */
public record IngestedPools(
        Ranking primary,
        IngestedRooms rooms,
        Ranking unitRanking,
        Path unitRankingPath,
        List<Ranking> crossPools
) {}
