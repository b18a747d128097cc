package com.roomdrawapp.roomdraw.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyKind;
import com.roomdrawapp.roomdraw.domain.anomaly.AnomalyLog;
import com.roomdrawapp.roomdraw.domain.estimate.EstimationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes the latest result as the dashboard's JSON file. The file is replaced atomically where the
 * file system allows, so the dashboard never reads a half-written snapshot.
 */
@Slf4j
@Component
public class JsonSnapshotResultSink implements EstimationResultSink {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean enabled;
    private final Path path;

    public JsonSnapshotResultSink(
            @Value("${estimator.snapshot.enabled:true}") boolean enabled,
            @Value("${estimator.snapshot.path:./public/dashboard-data.json}") String path
    ) {
        this.enabled = enabled;
        this.path = Paths.get(path).toAbsolutePath().normalize();
    }

    @Override
    public void publish(EstimationResult result, AnomalyLog anomalies) {
        if (!enabled) return;

        Path tmp = null;
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);

            // Per-run temp file; each publish moves a complete document into place
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), DashboardSnapshot.from(result));
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Dashboard snapshot written to {}", path);
        } catch (IOException e) {
            anomalies.report(AnomalyKind.SNAPSHOT_NOT_WRITTEN, path.toString(),
                    "Could not write dashboard snapshot: " + e.getMessage());
        } finally {
            deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary snapshot {}: {}", tmp, e.getMessage());
        }
    }
}
