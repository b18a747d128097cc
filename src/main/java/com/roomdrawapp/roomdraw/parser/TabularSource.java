package com.roomdrawapp.roomdraw.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A parsed table: header names as written (trimmed) and one map per data row keyed by those names.
 * A cell past the end of a short row is absent from its map.
 */
public final class TabularSource {

    private final String sourceName;
    private final List<Map<String, String>> rows;
    private final Map<String, String> headerByNorm;

    public TabularSource(String sourceName, List<String> headers, List<Map<String, String>> rows) {
        this.sourceName = sourceName;
        this.rows = rows.stream().map(Collections::unmodifiableMap).toList();

        Map<String, String> idx = new HashMap<>();
        for (String h : headers) idx.putIfAbsent(norm(h), h);
        this.headerByNorm = Collections.unmodifiableMap(idx);
    }

    public String sourceName() {
        return sourceName;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public boolean hasColumn(String column) {
        return headerByNorm.containsKey(norm(column));
    }

    /** Cell value for a column matched case-insensitively, or null when the row has no such cell. */
    public String value(Map<String, String> row, String column) {
        String header = headerByNorm.get(norm(column));
        return header == null ? null : row.get(header);
    }

    static String norm(String s) {
        if (s == null) return "";
        return s.trim().toLowerCase(Locale.ROOT).replace("_", " ");
    }
}
