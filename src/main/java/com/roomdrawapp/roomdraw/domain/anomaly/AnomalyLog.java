package com.roomdrawapp.roomdraw.domain.anomaly;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run collector. Every reported anomaly is logged at WARN and kept for the caller.
 * One instance per estimation run; not shared between threads.
 */
@Slf4j
public class AnomalyLog {

    private final List<Anomaly> anomalies = new ArrayList<>();

    public void report(AnomalyKind kind, String source, String reason) {
        report(new Anomaly(kind, source, reason, null));
    }

    public void report(AnomalyKind kind, String source, String reason, Map<String, String> row) {
        report(new Anomaly(kind, source, reason, row));
    }

    public void report(Anomaly anomaly) {
        anomalies.add(anomaly);
        log.warn(anomaly.describe());
    }

    public List<Anomaly> all() {
        return Collections.unmodifiableList(anomalies);
    }

    public int size() {
        return anomalies.size();
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }

    public long count(AnomalyKind kind) {
        return anomalies.stream().filter(a -> a.kind() == kind).count();
    }

    public Map<AnomalyKind, Long> countsByKind() {
        Map<AnomalyKind, Long> out = new EnumMap<>(AnomalyKind.class);
        for (Anomaly a : anomalies) out.merge(a.kind(), 1L, Long::sum);
        return out;
    }

    public List<String> describeAll() {
        return anomalies.stream().map(Anomaly::describe).toList();
    }
}
