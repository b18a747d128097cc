package com.roomdrawapp.roomdraw.domain.anomaly;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-fatal problem found during a run, with enough context to diagnose it without re-running.
 *
 * @param row snapshot of the offending row, empty for source-level anomalies
 */
public record Anomaly(AnomalyKind kind, String source, String reason, Map<String, String> row) {

    public Anomaly {
        row = (row == null || row.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append('[').append(kind).append("] ")
                .append(source == null ? "-" : source)
                .append(": ").append(reason);
        if (!row.isEmpty()) sb.append(" row=").append(row);
        return sb.toString();
    }
}
