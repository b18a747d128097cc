package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.draw.DrawRecord;
import com.roomdrawapp.roomdraw.domain.draw.Ranking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Draw-list table to {@link Ranking}: normalize rows, then order by draw time with the origin index
 * as tie-break. The tie-break makes the order total, so it does not rely on sort stability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Ranker {

    private final DrawRowNormalizer normalizer;

    public Ranking rank(TabularSource source, AnomalyLog anomalies) {
        List<DrawRecord> records = normalizer.normalize(source, anomalies);
        Ranking ranking = Ranking.of(source.sourceName(), records);
        log.info("Loaded {} entries from {} ({} rows dropped)",
                ranking.size(), source.sourceName(), source.rows().size() - records.size());
        return ranking;
    }
}
