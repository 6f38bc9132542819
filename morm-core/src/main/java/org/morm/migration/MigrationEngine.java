package org.morm.migration;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.morm.db.TransactionManager;
import org.morm.exception.MormException;
import org.morm.migration.baseline.SnapshotHasher;
import org.morm.migration.baseline.SnapshotStore;
import org.morm.migration.differs.SchemaDiffer;
import org.morm.migration.runner.MigrationRunner;
import org.morm.migration.runner.ModelApplyReport;
import org.morm.migration.unit.MigrationUnit;
import org.morm.migration.unit.MigrationUnitRepository;
import org.morm.migration.unit.MigrationUnitWriter;
import org.morm.migration.unit.ModelLocks;
import org.morm.migration.unit.UnitState;
import org.morm.model.ModelDefinition;
import org.morm.model.ModelRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Operator actions over a registry of models: generate, apply, delete-range and status.
 */
@Slf4j
public class MigrationEngine {
    @Getter
    private final ModelRegistry registry;
    @Getter
    private final MigrationSettings settings;
    private final TransactionManager transactionManager;

    @Getter
    private final SnapshotStore store;
    @Getter
    private final MigrationUnitRepository repository;
    private final MigrationPlanner planner;
    private final MigrationUnitWriter writer;
    private final MigrationRunner runner;

    /**
     * @param transactionManager database access for {@link #apply}; may be {@code null} when only
     *                           generating or inspecting units
     */
    public MigrationEngine(ModelRegistry registry, MigrationSettings settings, TransactionManager transactionManager) {
        this(registry, settings, transactionManager, new SchemaDiffer(), new SqlGenerator());
    }

    public MigrationEngine(ModelRegistry registry, MigrationSettings settings, TransactionManager transactionManager,
                           SchemaDiffer differ, SqlGenerator sqlGenerator) {
        this.registry = registry;
        this.settings = settings;
        this.transactionManager = transactionManager;

        SnapshotHasher hasher = new SnapshotHasher();
        ModelLocks locks = new ModelLocks(settings.getBasePath());
        this.store = new SnapshotStore(settings.getBasePath(), hasher);
        this.repository = new MigrationUnitRepository(settings.getBasePath(), settings.getSequenceWidth());
        this.planner = new MigrationPlanner(store, repository, differ, sqlGenerator);
        this.writer = new MigrationUnitWriter(repository, store, sqlGenerator, hasher, locks);
        this.runner = transactionManager == null ? null
                : new MigrationRunner(repository, store, transactionManager, locks, hasher);
    }

    /**
     * Plans every selected model first, so a declaration or generation error leaves no unit
     * behind, then writes the approved, non-empty plans.
     *
     * @return the units written
     */
    public List<MigrationUnit> generate(Collection<String> modelNames, ChangeReview review) {
        List<PlannedMigration> plans = new ArrayList<>();
        for (ModelDefinition model : registry.select(modelNames)) {
            plans.add(planner.plan(model));
        }

        List<MigrationUnit> written = new ArrayList<>();
        for (PlannedMigration plan : plans) {
            if (plan.isEmpty()) {
                log.info("No changes detected for model {}", plan.model());
                continue;
            }
            if (!review.approve(plan)) {
                log.info("Migration for model {} not approved, nothing written", plan.model());
                continue;
            }
            writer.write(plan.model(), plan.changeSet(), plan.baseline(), plan.target()).ifPresent(written::add);
        }
        return written;
    }

    public List<PlannedMigration> plan(Collection<String> modelNames) {
        return registry.select(modelNames).stream().map(planner::plan).toList();
    }

    /**
     * Applies queued units. History of every selected model is checked before anything runs;
     * then models are applied independently, up to {@code parallelism} at a time.
     */
    public List<ModelApplyReport> apply(Collection<String> modelNames) {
        if (runner == null) {
            throw new IllegalStateException("No database configured; can not apply migrations");
        }
        List<ModelDefinition> models = registry.select(modelNames);
        models.forEach(m -> runner.verifyHistory(m.getName()));

        if (settings.getParallelism() <= 1 || models.size() <= 1) {
            return models.stream().map(runner::apply).toList();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.getParallelism(), models.size()));
        try {
            List<Future<ModelApplyReport>> futures = new ArrayList<>();
            for (ModelDefinition model : models) {
                futures.add(executor.submit(() -> runner.apply(model)));
            }
            List<ModelApplyReport> reports = new ArrayList<>();
            for (Future<ModelApplyReport> future : futures) {
                reports.add(future.get());
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new MormException("Interrupted while applying migrations", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new MormException("Applying migrations failed", e.getCause());
        } finally {
            executor.shutdown();
        }
    }

    /**
     * @return deleted sequences per model
     */
    public Map<String, List<Long>> deleteRange(Collection<String> modelNames, long start, long end) {
        Map<String, List<Long>> deleted = new LinkedHashMap<>();
        for (ModelDefinition model : registry.select(modelNames)) {
            deleted.put(model.getName(), writer.deleteRange(model.getName(), start, end));
        }
        return deleted;
    }

    public List<ModelStatus> status(Collection<String> modelNames) {
        List<ModelStatus> result = new ArrayList<>();
        for (ModelDefinition model : registry.select(modelNames)) {
            String name = model.getName();
            List<MigrationUnit> units = repository.list(name);
            result.add(new ModelStatus(
                    name,
                    model.getTable(),
                    store.lastAppliedSequence(name),
                    sequencesIn(units, UnitState.QUEUED),
                    sequencesIn(units, UnitState.FAILED),
                    !planner.plan(model).isEmpty()));
        }
        return result;
    }

    private static List<Long> sequencesIn(List<MigrationUnit> units, UnitState state) {
        return units.stream().filter(u -> u.getState() == state).map(MigrationUnit::getSequence).toList();
    }
}
