package com.roomdrawapp.roomdraw.ingestion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Copies CSV fixtures from the test classpath into a working directory. */
public final class Fixtures {

    public static final String PRIMARY = "UpperclassTimeOrder2025.csv";
    public static final String SUB_POOL = "SpelmanTimeOrder2025.csv";
    public static final String ROOMS = "AvailableRoomsList2025.csv";
    public static final String MATHEY = "MatheyTimeOrder2025.csv";
    public static final String NO_DRAW_TIME = "NoDrawTimeColumn.csv";

    private Fixtures() {}

    public static void copy(Path dir, String... names) throws IOException {
        for (String name : names) {
            copyAs(dir, name, name);
        }
    }

    public static void copyAs(Path dir, String name, String target) throws IOException {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IOException("Missing fixture " + name);
            Files.copy(in, dir.resolve(target), StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
