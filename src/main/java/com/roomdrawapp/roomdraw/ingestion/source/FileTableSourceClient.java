package com.roomdrawapp.roomdraw.ingestion.source;

import com.roomdrawapp.common.exception.BadRequestException;
import com.roomdrawapp.common.exception.SourceLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class FileTableSourceClient implements TableSourceClient {

    private final Path directory;
    private final long maxBytes;

    public FileTableSourceClient(
            @Value("${estimator.input.directory:./data}") String directory,
            @Value("${estimator.input.maxBytes:10485760}") long maxBytes
    ) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
        this.maxBytes = maxBytes;
    }

    @Override
    public Path resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new BadRequestException("Pool location must not be blank");
        }
        Path p = Paths.get(location.trim());
        Path resolved = (p.isAbsolute() ? p : directory.resolve(p)).toAbsolutePath().normalize();
        if (!resolved.startsWith(directory)) {
            throw new BadRequestException("Pool location is outside the input directory", Map.of(
                    "location", location
            ));
        }
        return resolved;
    }

    @Override
    public Optional<Path> locate(String globPattern) {
        if (globPattern == null || globPattern.isBlank()) return Optional.empty();
        if (!Files.isDirectory(directory)) {
            log.warn("Input directory {} does not exist", directory);
            return Optional.empty();
        }

        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, globPattern)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) matches.add(p.toAbsolutePath().normalize());
            }
        } catch (IOException e) {
            throw new SourceLoadException(globPattern, "Failed to list " + directory + ": " + safeMsg(e), e);
        }

        // Exports carry the year in the name, so the greatest name is the newest list
        Optional<Path> chosen = matches.stream().max(Comparator.comparing(p -> p.getFileName().toString()));
        if (matches.size() > 1) {
            log.info("{} files match '{}'; using {}", matches.size(), globPattern, chosen.get().getFileName());
        }
        return chosen;
    }

    @Override
    public FetchedTable fetch(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new SourceLoadException(name, "File not found at " + path);
        }
        try {
            long size = Files.size(path);
            if (size > maxBytes) {
                throw new SourceLoadException(name, "File " + name + " is too large (" + size + " bytes > " + maxBytes + ")");
            }
            return new FetchedTable(Files.readAllBytes(path), name, path);
        } catch (IOException e) {
            throw new SourceLoadException(name, "Error reading file " + path + ": " + safeMsg(e), e);
        }
    }

    private static String safeMsg(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
