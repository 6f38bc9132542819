package org.morm.migration.unit;

import lombok.extern.slf4j.Slf4j;
import org.morm.exception.StaleBaselineException;
import org.morm.exception.UnitDeletionException;
import org.morm.migration.SqlGenerator;
import org.morm.migration.baseline.SnapshotHasher;
import org.morm.migration.baseline.SnapshotStore;
import org.morm.model.SchemaSnapshot;
import org.morm.model.SchemaValidator;
import org.morm.model.change.ChangeSet;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Allocates sequence numbers and turns change sets into queued units on disk.
 */
@Slf4j
public class MigrationUnitWriter {
    private final MigrationUnitRepository repository;
    private final SnapshotStore store;
    private final SqlGenerator sqlGenerator;
    private final SnapshotHasher hasher;
    private final ModelLocks locks;

    public MigrationUnitWriter(MigrationUnitRepository repository, SnapshotStore store, SqlGenerator sqlGenerator,
                               SnapshotHasher hasher, ModelLocks locks) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator must not be null");
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
    }

    /**
     * Queues a unit for {@code changeSet}. The target is validated and the SQL rendered before a
     * sequence is allocated, so an invalid declaration or an unrenderable change leaves nothing on disk.
     * Under the model lock, {@code baseline} must still be the newest snapshot of the model.
     *
     * @param baseline snapshot the change set was computed from, {@code null} for a first create
     * @param target   snapshot the model has once the unit is applied
     * @return the written unit, empty when there is nothing to write
     */
    public Optional<MigrationUnit> write(String model, ChangeSet changeSet, SchemaSnapshot baseline, SchemaSnapshot target) {
        Objects.requireNonNull(changeSet, "changeSet must not be null");
        if (changeSet.isEmpty()) {
            log.debug("No changes for model {}, nothing queued", model);
            return Optional.empty();
        }
        Objects.requireNonNull(target, "target must not be null");
        SchemaValidator.validate(target);
        List<String> sql = sqlGenerator.generate(target.getTable(), changeSet);

        String baselineHash = hasher.hash(baseline);
        return Optional.of(locks.withLock(model, () -> {
            SchemaSnapshot latest = repository.latestSnapshot(model).orElseGet(() -> store.load(model));
            if (!Objects.equals(baselineHash, hasher.hash(latest))) {
                throw new StaleBaselineException("Unit history of model " + model
                        + " changed after this migration was planned; run generate again");
            }
            long sequence = nextSequence(model);
            MigrationUnit unit = MigrationUnit.builder()
                    .model(model)
                    .sequence(sequence)
                    .state(UnitState.QUEUED)
                    .createdAt(now())
                    .baselineHash(baselineHash)
                    .targetHash(hasher.hash(target))
                    .changeSet(changeSet)
                    .generatedSql(new ArrayList<>(sql))
                    .hooks(UnitHooks.template())
                    .snapshot(target)
                    .build();
            repository.recordHighWaterMark(model, sequence);
            repository.write(unit);
            log.info("Queued {} with {} change(s), {} statement(s)",
                    repository.fileName(model, sequence), changeSet.size(), sql.size());
            return unit;
        }));
    }

    /**
     * One above every sequence this model ever used: live units, trashed units, the recorded
     * high-water mark and the store's last applied sequence.
     */
    public long nextSequence(String model) {
        long max = Math.max(repository.highWaterMark(model), store.lastAppliedSequence(model));
        max = Math.max(max, repository.highestSequence(model).orElse(0L));
        max = Math.max(max, repository.highestTrashedSequence(model).orElse(0L));
        return max + 1;
    }

    /**
     * Deletes the queued or failed units in {@code [start, end]}. Nothing is deleted if any unit in
     * the range has already been applied.
     *
     * @return the sequences actually deleted
     */
    public List<Long> deleteRange(String model, long start, long end) {
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("Invalid sequence range [" + start + ", " + end + "]");
        }
        return locks.withLock(model, () -> {
            List<MigrationUnit> inRange = repository.list(model).stream()
                    .filter(u -> u.getSequence() >= start && u.getSequence() <= end)
                    .toList();
            for (MigrationUnit unit : inRange) {
                if (unit.isApplied()) {
                    throw new UnitDeletionException("Migration " + repository.fileName(model, unit.getSequence())
                            + " is already applied and can not be deleted");
                }
            }
            long highest = repository.highestSequence(model).orElse(0L);
            if (!inRange.isEmpty() && end < highest) {
                log.warn("Deleting units {}..{} of model {} leaves later units queued; they were generated "
                        + "assuming the deleted ones apply first", start, end, model);
            }
            List<Long> deleted = new ArrayList<>();
            for (MigrationUnit unit : inRange) {
                if (repository.trash(model, unit.getSequence())) {
                    deleted.add(unit.getSequence());
                }
            }
            log.info("Deleted {} unit(s) of model {} in range [{}, {}]", deleted.size(), model, start, end);
            return deleted;
        });
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
