package com.roomdrawapp.roomdraw.ingestion;

import com.roomdrawapp.common.exception.EstimationFailureException;
import com.roomdrawapp.common.exception.EstimationFailureReason;
import com.roomdrawapp.common.exception.SourceLoadException;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import com.roomdrawapp.roomdraw.domain.room.RoomRecord;
import com.roomdrawapp.roomdraw.ingestion.model.IngestedPools;
import com.roomdrawapp.roomdraw.ingestion.model.IngestedRooms;
import com.roomdrawapp.roomdraw.ingestion.source.TableSourceClient;
import com.roomdrawapp.roomdraw.parser.CsvTableParser;
import com.roomdrawapp.roomdraw.parser.DrawRowNormalizer;
import com.roomdrawapp.roomdraw.parser.Ranker;
import com.roomdrawapp.roomdraw.parser.RoomRowNormalizer;
import com.roomdrawapp.roomdraw.parser.TabularSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;

/**
 * Loads every input table of a run. Only the primary ranking is mandatory; any other source that
 * fails becomes a reported anomaly and the dependent exclusion goes inactive.
 */
@Slf4j
@Service
public class IngestionService {

    private final TableSourceClient tableSourceClient;
    private final CsvTableParser csvTableParser;
    private final Ranker ranker;
    private final RoomRowNormalizer roomRowNormalizer;

    private final String primaryPattern;
    private final String roomsPattern;
    private final String unitPattern;

    public IngestionService(
            TableSourceClient tableSourceClient,
            CsvTableParser csvTableParser,
            Ranker ranker,
            RoomRowNormalizer roomRowNormalizer,
            @Value("${estimator.input.primary-pattern:UpperclassTimeOrder*.csv}") String primaryPattern,
            @Value("${estimator.input.rooms-pattern:AvailableRoomsList*.csv}") String roomsPattern,
            @Value("${estimator.input.sub-pool-pattern:SpelmanTimeOrder*.csv}") String unitPattern
    ) {
        this.tableSourceClient = tableSourceClient;
        this.csvTableParser = csvTableParser;
        this.ranker = ranker;
        this.roomRowNormalizer = roomRowNormalizer;
        this.primaryPattern = primaryPattern;
        this.roomsPattern = roomsPattern;
        this.unitPattern = unitPattern;
    }

    public IngestedPools ingest(List<String> additionalPools, AnomalyLog anomalies) {
        Ranking primary = loadPrimaryRanking(anomalies);
        IngestedRooms rooms = loadRooms(anomalies);

        Optional<Path> unitPath = locate(unitPattern, anomalies);
        Ranking unitRanking = unitPath.map(p -> loadRanking(p, anomalies)).orElse(null);

        List<Ranking> crossPools = loadAdditionalPools(additionalPools, unitPath.orElse(null), anomalies);

        return new IngestedPools(primary, rooms, unitRanking, unitPath.orElse(null), crossPools);
    }

    // -----------------------------
    // PRIMARY
    // -----------------------------

    public Ranking loadPrimaryRanking(AnomalyLog anomalies) {
        Path path = locate(primaryPattern, anomalies).orElseThrow(() -> new EstimationFailureException(
                "Could not locate the primary draw list",
                EstimationFailureReason.PRIMARY_RANKING_UNAVAILABLE,
                Map.of("pattern", primaryPattern)
        ));

        Ranking ranking;
        try {
            ranking = ranker.rank(parse(path, DrawRowNormalizer.REQUIRED_COLUMNS), anomalies);
        } catch (SourceLoadException e) {
            throw new EstimationFailureException(
                    "Could not load the primary draw list: " + e.getMessage(),
                    EstimationFailureReason.PRIMARY_RANKING_UNAVAILABLE,
                    Map.of("source", e.getSourceName(), "path", path.toString()),
                    e
            );
        }

        if (ranking.isEmpty()) {
            throw new EstimationFailureException(
                    "Primary draw list " + ranking.sourceName() + " has no usable rows",
                    EstimationFailureReason.PRIMARY_RANKING_UNAVAILABLE,
                    Map.of("source", ranking.sourceName(), "anomalies", anomalies.size())
            );
        }
        return ranking;
    }

    // -----------------------------
    // ROOMS
    // -----------------------------

    public IngestedRooms loadRooms(AnomalyLog anomalies) {
        Optional<Path> path = locate(roomsPattern, anomalies);
        if (path.isEmpty()) return IngestedRooms.unavailable(roomsPattern);

        try {
            TabularSource table = parse(path.get(), RoomRowNormalizer.REQUIRED_COLUMNS);
            List<RoomRecord> rooms = roomRowNormalizer.normalize(table, anomalies);
            log.info("Loaded {} rooms from {}", rooms.size(), table.sourceName());
            return new IngestedRooms(table.sourceName(), rooms);
        } catch (SourceLoadException e) {
            anomalies.report(AnomalyKind.SOURCE_UNAVAILABLE, e.getSourceName(),
                    e.getMessage() + "; capacity-gated exclusion is inactive");
            return IngestedRooms.unavailable(e.getSourceName());
        }
    }

    // -----------------------------
    // POOLS
    // -----------------------------

    /**
     * Loads the parallel pools in order. A location that points at the scarce unit's own list is
     * skipped since that pool is accounted for by capacity.
     */
    public List<Ranking> loadAdditionalPools(List<String> locations, Path unitPath, AnomalyLog anomalies) {
        if (locations == null || locations.isEmpty()) return List.of();

        List<Ranking> out = new ArrayList<>();
        for (String location : locations) {
            if (location == null || location.isBlank()) continue;

            Path path = tableSourceClient.resolve(location);
            if (unitPath != null && path.equals(unitPath)) {
                anomalies.report(AnomalyKind.SOURCE_SKIPPED, location,
                        "Skipping " + location + " as it is the designated sub-pool list");
                continue;
            }

            Ranking r = loadRanking(path, anomalies);
            if (r != null) out.add(r);
        }
        return out;
    }

    /** Null when the file cannot be used; the reason is reported. */
    Ranking loadRanking(Path path, AnomalyLog anomalies) {
        try {
            return ranker.rank(parse(path, DrawRowNormalizer.REQUIRED_COLUMNS), anomalies);
        } catch (SourceLoadException e) {
            anomalies.report(AnomalyKind.SOURCE_UNAVAILABLE, e.getSourceName(), e.getMessage() + "; skipping source");
            return null;
        }
    }

    // -----------------------------
    // helpers
    // -----------------------------

    private TabularSource parse(Path path, List<String> requiredColumns) {
        TableSourceClient.FetchedTable fetched = tableSourceClient.fetch(path);
        return csvTableParser.parse(fetched.bytes(), fetched.sourceName(), requiredColumns);
    }

    private Optional<Path> locate(String pattern, AnomalyLog anomalies) {
        try {
            Optional<Path> p = tableSourceClient.locate(pattern);
            if (p.isEmpty()) {
                anomalies.report(AnomalyKind.SOURCE_UNAVAILABLE, pattern, "No input file matches '" + pattern + "'");
            }
            return p;
        } catch (SourceLoadException e) {
            anomalies.report(AnomalyKind.SOURCE_UNAVAILABLE, pattern, e.getMessage());
            return Optional.empty();
        }
    }
}
