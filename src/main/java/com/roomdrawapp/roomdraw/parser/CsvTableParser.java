package com.roomdrawapp.roomdraw.parser;

import com.roomdrawapp.common.exception.SourceLoadException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.*;

@Component
public class CsvTableParser {

    private static final char BOM = '\uFEFF';

    /**
     * Parses a header-first CSV export. Blank lines are skipped; they do not take an origin index.
     *
     * @throws SourceLoadException when the content is empty or a required column is missing
     */
    public TabularSource parse(byte[] bytes, String sourceName, List<String> requiredColumns) {
        if (bytes == null || bytes.length == 0) {
            throw new SourceLoadException(sourceName, "File " + sourceName + " is empty");
        }

        String text = new String(bytes, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) text = text.substring(1);

        // Quoted cells spanning lines are not supported
        List<String> lines = Arrays.stream(text.split("\\R"))
                .filter(s -> !s.isBlank())
                .toList();

        if (lines.isEmpty()) {
            throw new SourceLoadException(sourceName, "File " + sourceName + " has no header row");
        }

        List<String> header = parseCsvRow(lines.get(0));

        Set<String> present = new HashSet<>();
        for (String h : header) present.add(TabularSource.norm(h));
        List<String> missing = new ArrayList<>();
        for (String col : requiredColumns == null ? List.<String>of() : requiredColumns) {
            if (!present.contains(TabularSource.norm(col))) missing.add(col);
        }
        if (!missing.isEmpty()) {
            throw new SourceLoadException(sourceName,
                    "File " + sourceName + " is missing required columns: " + missing + ". Check CSV header.");
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = parseCsvRow(lines.get(i));
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size() && c < cells.size(); c++) {
                row.putIfAbsent(header.get(c), cells.get(c));
            }
            rows.add(row);
        }

        return new TabularSource(sourceName, header, rows);
    }

    // Minimal CSV row parser that respects quotes
    static List<String> parseCsvRow(String line) {
        if (line == null) return List.of();
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    // escaped quote
                    cur.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
                continue;
            }

            if (c == ',' && !inQuotes) {
                out.add(cur.toString());
                cur.setLength(0);
                continue;
            }

            cur.append(c);
        }

        out.add(cur.toString());
        return out.stream().map(String::trim).toList();
    }
}
