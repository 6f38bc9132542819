package org.morm.migration.baseline;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.morm.exception.MormException;
import org.morm.model.SchemaSnapshot;
import org.morm.support.AtomicFiles;
import org.morm.support.ObjectMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Per-model applied baseline, kept in {@code <basePath>/<model>/snapshot.json}.
 * Only the runner saves; generation only reads.
 */
@Slf4j
public class SnapshotStore {

    public static final String STORE_FILE = "snapshot.json";

    @Getter
    private final Path basePath;
    private final ObjectMapper objectMapper;
    private final SnapshotHasher hasher;

    public SnapshotStore(Path basePath) {
        this(basePath, new SnapshotHasher());
    }

    public SnapshotStore(Path basePath, SnapshotHasher hasher) {
        this.basePath = basePath;
        this.hasher = hasher;
        this.objectMapper = ObjectMappers.json();
    }

    public Optional<AppliedBaseline> loadBaseline(String model) {
        Path file = storeFile(model);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), AppliedBaseline.class));
        } catch (IOException e) {
            throw new MormException("Failed to read snapshot store " + file, e);
        }
    }

    /**
     * @return the applied snapshot, {@code null} when the model never had one
     */
    public SchemaSnapshot load(String model) {
        return loadBaseline(model).map(AppliedBaseline::getSnapshot).orElse(null);
    }

    public long lastAppliedSequence(String model) {
        return loadBaseline(model).map(AppliedBaseline::getLastAppliedSequence).orElse(0L);
    }

    /**
     * Replaces the applied snapshot and the last applied sequence in one atomic file move.
     */
    public void save(String model, SchemaSnapshot snapshot, long sequence) {
        AppliedBaseline baseline = AppliedBaseline.builder()
                .snapshot(snapshot)
                .lastAppliedSequence(sequence)
                .snapshotHash(hasher.hash(snapshot))
                .savedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .build();
        Path file = storeFile(model);
        try {
            AtomicFiles.writeJson(objectMapper, file, baseline);
        } catch (IOException e) {
            throw new MormException("Failed to write snapshot store " + file, e);
        }
        log.debug("Snapshot of model {} saved at sequence {}", model, sequence);
    }

    public boolean hasBaseline(String model) {
        return Files.exists(storeFile(model));
    }

    public Path modelDirectory(String model) {
        return basePath.resolve(model);
    }

    private Path storeFile(String model) {
        return modelDirectory(model).resolve(STORE_FILE);
    }
}
