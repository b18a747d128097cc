package com.roomdrawapp.roomdraw.ingestion.source;

import java.nio.file.Path;
import java.util.Optional;

public interface TableSourceClient {

    /** Resolves a caller-supplied location (file name or path) against the input directory. */
    Path resolve(String location);

    /** Newest file in the input directory whose name matches the glob, if any. */
    Optional<Path> locate(String globPattern);

    FetchedTable fetch(Path path);

    record FetchedTable(byte[] bytes, String sourceName, Path path) {}
}
