package com.ideatrack.backend.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ideatrack.backend.config.IdeaTrackProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file holding the last committed {@link StoreSnapshot}. Disabled when no path is configured.
 */
@Component
public class StoreSnapshotFile {

    private static final Logger log = LoggerFactory.getLogger(StoreSnapshotFile.class);

    private final ObjectMapper om;
    private final Path filePath;

    public StoreSnapshotFile(IdeaTrackProperties props, ObjectMapper om) {
        this.om = om;
        String configured = props.getStorage().getSnapshotPath();
        this.filePath = (configured == null || configured.isBlank()) ? null : Paths.get(configured.trim());
    }

    public boolean isEnabled() {
        return filePath != null;
    }

    public Optional<StoreSnapshot> load() {
        if (!isEnabled() || !Files.exists(filePath)) {
            return Optional.empty();
        }
        try {
            byte[] raw = Files.readAllBytes(filePath);
            if (raw.length == 0) {
                return Optional.empty();
            }
            StoreSnapshot snapshot = om.readValue(raw, StoreSnapshot.class);
            log.info("Loaded snapshot {} ({} submissions, {} edges, {} outcomes)",
                    filePath, sizeOf(snapshot.submissions()), sizeOf(snapshot.lineageEdges()),
                    sizeOf(snapshot.outcomes()));
            return Optional.of(snapshot);
        } catch (IOException e) {
            // 손상된 스냅샷으로 빈 상태 기동 금지
            throw new IllegalStateException("Unreadable snapshot " + filePath, e);
        }
    }

    public void write(StoreSnapshot snapshot) {
        if (!isEnabled()) {
            return;
        }
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
            Files.write(tmp, om.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
            Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + filePath, e);
        }
    }

    private static int sizeOf(java.util.List<?> list) {
        return list == null ? 0 : list.size();
    }
}
