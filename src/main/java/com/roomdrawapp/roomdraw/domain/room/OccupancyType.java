package com.roomdrawapp.roomdraw.domain.room;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum OccupancyType {
    SINGLE("SINGLE", 1),
    DOUBLE("DOUBLE", 2),
    TRIPLE("TRIPLE", 3),
    QUAD("QUAD", 4),
    QUINT("QUINT", 5),
    SIX_PERSON("6PERSON", 6);

    private final String code;
    private final int spots;

    OccupancyType(String code, int spots) {
        this.code = code;
        this.spots = spots;
    }

    public String code() {
        return code;
    }

    public int spots() {
        return spots;
    }

    public static Optional<OccupancyType> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toUpperCase(Locale.ROOT);
        for (OccupancyType t : values()) {
            if (t.code.equals(c) || t.name().equals(c)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Code to spot count for every known type, in declaration order. */
    public static Map<String, Integer> defaultSpotMap() {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (OccupancyType t : values()) m.put(t.code, t.spots);
        return Collections.unmodifiableMap(m);
    }
}
