package org.morm.migration.unit;

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
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Unit files of a model under {@code <basePath>/<model>/<model>_<sequence>.json}.
 * Deleted units are moved to {@code .trash} and the highest sequence ever allocated is kept in
 * {@code .sequence}, so neither deletion nor a lost file lets a number come back.
 */
@Slf4j
public class MigrationUnitRepository {

    public static final String TRASH_DIR = ".trash";
    public static final String SEQUENCE_FILE = ".sequence";
    public static final int DEFAULT_SEQUENCE_WIDTH = 8;

    @Getter
    private final Path basePath;
    private final int sequenceWidth;
    private final ObjectMapper objectMapper;

    public MigrationUnitRepository(Path basePath) {
        this(basePath, DEFAULT_SEQUENCE_WIDTH);
    }

    public MigrationUnitRepository(Path basePath, int sequenceWidth) {
        if (sequenceWidth < 1) {
            throw new IllegalArgumentException("sequenceWidth must be positive: " + sequenceWidth);
        }
        this.basePath = basePath;
        this.sequenceWidth = sequenceWidth;
        this.objectMapper = ObjectMappers.json();
    }

    /**
     * All units of the model in ascending sequence order.
     */
    public List<MigrationUnit> list(String model) {
        List<MigrationUnit> units = new ArrayList<>();
        for (long sequence : sequencesIn(modelDirectory(model), model)) {
            units.add(readFile(unitFile(model, sequence)));
        }
        units.sort(Comparator.comparingLong(MigrationUnit::getSequence));
        return units;
    }

    /**
     * Target snapshot of the newest unit carrying one, queued or applied.
     */
    public Optional<SchemaSnapshot> latestSnapshot(String model) {
        List<MigrationUnit> units = list(model);
        for (int i = units.size() - 1; i >= 0; i--) {
            SchemaSnapshot snapshot = units.get(i).getSnapshot();
            if (snapshot != null) {
                return Optional.of(snapshot);
            }
        }
        return Optional.empty();
    }

    public Optional<MigrationUnit> read(String model, long sequence) {
        Path file = unitFile(model, sequence);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(readFile(file));
    }

    public void write(MigrationUnit unit) {
        Path file = unitFile(unit.getModel(), unit.getSequence());
        try {
            AtomicFiles.writeJson(objectMapper, file, unit);
        } catch (IOException e) {
            throw new MormException("Failed to write migration unit " + file, e);
        }
    }

    /**
     * Moves the unit file into the model's trash directory.
     *
     * @return {@code false} if there was no such unit
     */
    public boolean trash(String model, long sequence) {
        Path file = unitFile(model, sequence);
        if (!Files.exists(file)) {
            return false;
        }
        Path target = modelDirectory(model).resolve(TRASH_DIR).resolve(file.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MormException("Failed to delete migration unit " + file, e);
        }
        return true;
    }

    public OptionalLong highestSequence(String model) {
        return sequencesIn(modelDirectory(model), model).stream().mapToLong(Long::longValue).max();
    }

    public OptionalLong highestTrashedSequence(String model) {
        return sequencesIn(modelDirectory(model).resolve(TRASH_DIR), model).stream().mapToLong(Long::longValue).max();
    }

    public long highWaterMark(String model) {
        Path file = modelDirectory(model).resolve(SEQUENCE_FILE);
        if (!Files.exists(file)) {
            return 0L;
        }
        try {
            return Long.parseLong(Files.readString(file).trim());
        } catch (IOException | NumberFormatException e) {
            throw new MormException("Failed to read sequence high-water mark " + file, e);
        }
    }

    public void recordHighWaterMark(String model, long sequence) {
        if (sequence <= highWaterMark(model)) {
            return;
        }
        Path file = modelDirectory(model).resolve(SEQUENCE_FILE);
        try {
            AtomicFiles.writeString(file, Long.toString(sequence));
        } catch (IOException e) {
            throw new MormException("Failed to write sequence high-water mark " + file, e);
        }
    }

    public Path modelDirectory(String model) {
        return basePath.resolve(model);
    }

    public Path unitFile(String model, long sequence) {
        return modelDirectory(model).resolve(fileName(model, sequence));
    }

    public String fileName(String model, long sequence) {
        return model + "_" + String.format("%0" + sequenceWidth + "d", sequence) + ".json";
    }

    private MigrationUnit readFile(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), MigrationUnit.class);
        } catch (IOException e) {
            throw new MormException("Failed to read migration unit " + file, e);
        }
    }

    private static List<Long> sequencesIn(Path directory, String model) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        Pattern pattern = Pattern.compile(Pattern.quote(model) + "_(\\d+)\\.json");
        try (Stream<Path> files = Files.list(directory)) {
            List<Long> sequences = new ArrayList<>();
            files.forEach(f -> {
                Matcher m = pattern.matcher(f.getFileName().toString());
                if (m.matches()) {
                    sequences.add(Long.parseLong(m.group(1)));
                }
            });
            sequences.sort(Comparator.naturalOrder());
            return sequences;
        } catch (IOException e) {
            throw new MormException("Failed to list migration units in " + directory, e);
        }
    }
}
