package com.roomdrawapp.roomdraw.domain.draw;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Draw records of one source in draw order: draw time ascending, then origin index ascending.
 * Never mutated after construction.
 */
public final class Ranking {

    public static final Comparator<DrawRecord> DRAW_ORDER = Comparator
            .comparing(DrawRecord::drawTime)
            .thenComparingInt(DrawRecord::originIndex);

    private final String sourceName;
    private final List<DrawRecord> records;

    private Ranking(String sourceName, List<DrawRecord> records) {
        this.sourceName = sourceName;
        this.records = records;
    }

    public static Ranking of(String sourceName, List<DrawRecord> records) {
        List<DrawRecord> sorted = (records == null ? List.<DrawRecord>of() : records).stream()
                .sorted(DRAW_ORDER)
                .toList();
        return new Ranking(sourceName, sorted);
    }

    public String sourceName() {
        return sourceName;
    }

    public List<DrawRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Zero-based position of the first record matching the name, case-insensitive and trimmed.
     */
    public Optional<Integer> indexOfName(String firstName, String lastName) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).matchesName(firstName, lastName)) return Optional.of(i);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Ranking{" + sourceName + ", size=" + records.size() + "}";
    }
}
