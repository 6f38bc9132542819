package org.morm.migration.runner;

import lombok.extern.slf4j.Slf4j;
import org.morm.db.SqlExecutor;
import org.morm.db.TransactionManager;
import org.morm.exception.ApplyException;
import org.morm.exception.HistoryConsistencyException;
import org.morm.migration.baseline.SnapshotHasher;
import org.morm.migration.baseline.SnapshotStore;
import org.morm.migration.unit.MigrationUnit;
import org.morm.migration.unit.MigrationUnitRepository;
import org.morm.migration.unit.ModelLocks;
import org.morm.migration.unit.UnitState;
import org.morm.model.ModelDefinition;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies the queued units of a model in ascending sequence order, one transaction per unit.
 * The first failure halts the model; later units stay queued. Each unit's transaction also
 * records the unit in {@link AppliedHistory}, which decides whether a unit ran when its file
 * says otherwise.
 */
@Slf4j
public class MigrationRunner {
    private final MigrationUnitRepository repository;
    private final SnapshotStore store;
    private final TransactionManager transactionManager;
    private final ModelLocks locks;
    private final SnapshotHasher hasher;
    private final AppliedHistory history;

    public MigrationRunner(MigrationUnitRepository repository, SnapshotStore store,
                           TransactionManager transactionManager, ModelLocks locks, SnapshotHasher hasher) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.hasher = Objects.requireNonNull(hasher, "hasher must not be null");
        this.history = new AppliedHistory(transactionManager);
    }

    public ModelApplyReport apply(ModelDefinition model) {
        String name = model.getName();
        return locks.withLock(name, () -> {
            List<MigrationUnit> units = recoverCommitted(name, repository.list(name));
            long lastApplied = reconcile(name, units, store.lastAppliedSequence(name));

            List<MigrationUnit> pending = units.stream()
                    .filter(u -> u.getSequence() > lastApplied && !u.isApplied())
                    .toList();
            if (pending.isEmpty()) {
                log.info("Model {} is up to date at sequence {}", name, lastApplied);
                return ModelApplyReport.builder().model(name).lastAppliedSequence(lastApplied).build();
            }

            List<Long> applied = new ArrayList<>();
            long current = lastApplied;
            for (int i = 0; i < pending.size(); i++) {
                MigrationUnit unit = pending.get(i);
                String appliedAt = now();
                try {
                    executeUnit(model, unit, appliedAt);
                } catch (Exception e) {
                    ApplyException failure = markFailed(unit, e);
                    List<Long> skipped = pending.subList(i + 1, pending.size()).stream()
                            .map(MigrationUnit::getSequence)
                            .toList();
                    if (!skipped.isEmpty()) {
                        log.warn("Model {} halted; units {} left queued", name, skipped);
                    }
                    return ModelApplyReport.builder()
                            .model(name)
                            .appliedSequences(applied)
                            .skippedSequences(skipped)
                            .failedSequence(unit.getSequence())
                            .failure(failure)
                            .lastAppliedSequence(current)
                            .build();
                }
                markApplied(name, unit, appliedAt);
                applied.add(unit.getSequence());
                current = unit.getSequence();
            }
            return ModelApplyReport.builder()
                    .model(name)
                    .appliedSequences(applied)
                    .lastAppliedSequence(current)
                    .build();
        });
    }

    /**
     * Checks the unit history of a model against its snapshot store without applying any unit,
     * advancing the store where the history allows it.
     *
     * @throws HistoryConsistencyException if they disagree in a way that can not be repaired
     */
    public void verifyHistory(String model) {
        locks.withLock(model, () -> reconcile(model, recoverCommitted(model, repository.list(model)),
                store.lastAppliedSequence(model)));
    }

    /**
     * Marks applied every unit that {@link AppliedHistory} lists but whose file is still queued or
     * failed. That happens when the process stopped after a unit committed and before its file
     * was written.
     */
    List<MigrationUnit> recoverCommitted(String model, List<MigrationUnit> units) {
        Map<Long, String> committed = history.committedUnits(model);
        for (MigrationUnit unit : units) {
            String appliedAt = committed.get(unit.getSequence());
            if (appliedAt != null && !unit.isApplied()) {
                log.warn("Unit {} of model {} committed at {} but is marked {}; marking it applied",
                        unit.getSequence(), model, appliedAt, unit.getState());
                unit.setState(UnitState.APPLIED);
                unit.setAppliedAt(appliedAt);
                unit.setFailure(null);
                repository.write(unit);
            }
        }
        return units;
    }

    /**
     * A unit at or below the store's sequence must be applied, and applied units must form a
     * prefix of the history. Applied units above the store's sequence mean the process stopped
     * between marking a unit and saving the store; the store is advanced from those units.
     *
     * @return the last applied sequence after repair
     */
    long reconcile(String model, List<MigrationUnit> units, long lastApplied) {
        MigrationUnit firstNotApplied = null;
        MigrationUnit lastHealable = null;
        for (MigrationUnit unit : units) {
            if (unit.getSequence() <= lastApplied && !unit.isApplied()) {
                throw new HistoryConsistencyException(String.format(
                        "Snapshot store of model %s records sequence %d as applied but unit %d is %s",
                        model, lastApplied, unit.getSequence(), unit.getState()));
            }
            if (unit.isApplied()) {
                if (firstNotApplied != null) {
                    throw new HistoryConsistencyException(String.format(
                            "Unit %d of model %s is applied after unit %d which is %s",
                            unit.getSequence(), model, firstNotApplied.getSequence(), firstNotApplied.getState()));
                }
                if (unit.getSequence() > lastApplied) {
                    lastHealable = unit;
                }
            } else if (firstNotApplied == null) {
                firstNotApplied = unit;
            }
        }
        if (lastHealable == null) {
            return lastApplied;
        }
        if (lastHealable.getSnapshot() == null) {
            throw new HistoryConsistencyException(String.format(
                    "Unit %d of model %s is applied but carries no snapshot to restore the store from",
                    lastHealable.getSequence(), model));
        }
        log.warn("Snapshot store of model {} is behind its history ({} < {}); advancing it",
                model, lastApplied, lastHealable.getSequence());
        store.save(model, lastHealable.getSnapshot(), lastHealable.getSequence());
        return lastHealable.getSequence();
    }

    private void executeUnit(ModelDefinition model, MigrationUnit unit, String appliedAt) throws Exception {
        String name = model.getName();
        String currentHash = hasher.hash(store.load(name));
        if (!Objects.equals(currentHash, unit.getBaselineHash())) {
            log.warn("Unit {} of model {} was generated against a different snapshot than the one applied",
                    unit.getSequence(), name);
        }
        log.info("Applying {} ({} statement(s))", repository.fileName(name, unit.getSequence()),
                unit.getGeneratedSql().size());

        transactionManager.inTransaction(db -> {
            HookContext context = new HookContext(db, model, unit);
            MigrationHook hook = loadHook(unit);

            runStatements(db, unit.getHooks().getRunBefore());
            hook.runBefore(context);
            runStatements(db, unit.getGeneratedSql());
            hook.runAfter(context);
            runStatements(db, unit.getHooks().getRunAfter());
            history.record(db, name, unit.getSequence(), appliedAt);
            return null;
        });
    }

    /**
     * Runs after commit. An interruption before the unit is written is repaired by
     * {@link #recoverCommitted}, one before the store is saved by {@link #reconcile}.
     */
    private void markApplied(String name, MigrationUnit unit, String appliedAt) {
        unit.setState(UnitState.APPLIED);
        unit.setAppliedAt(appliedAt);
        unit.setFailure(null);
        repository.write(unit);
        store.save(name, unit.getSnapshot(), unit.getSequence());
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private static void runStatements(SqlExecutor db, List<String> statements) throws Exception {
        for (String sql : statements) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Apply cancelled before: " + sql);
            }
            db.execute(sql);
        }
    }

    private static MigrationHook loadHook(MigrationUnit unit) throws ReflectiveOperationException {
        String hookClass = unit.getHooks().getHookClass();
        if (hookClass == null || hookClass.isBlank()) {
            return MigrationHook.NONE;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        Class<?> type = Class.forName(hookClass.trim(), true,
                loader != null ? loader : MigrationRunner.class.getClassLoader());
        if (!MigrationHook.class.isAssignableFrom(type)) {
            throw new ClassCastException(hookClass + " does not implement " + MigrationHook.class.getName());
        }
        return (MigrationHook) type.getDeclaredConstructor().newInstance();
    }

    private ApplyException markFailed(MigrationUnit unit, Exception cause) {
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        ApplyException failure = new ApplyException(unit.getModel(), unit.getSequence(), cause);
        unit.setState(UnitState.FAILED);
        unit.setFailure(failure.getMessage());
        repository.write(unit);
        log.error(failure.getMessage());
        return failure;
    }
}
