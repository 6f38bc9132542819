package org.morm.migration.runner;

import org.morm.db.SqlExecutor;
import org.morm.db.TransactionCallback;
import org.morm.db.TransactionManager;
import org.morm.exception.HistoryConsistencyException;
import org.morm.migration.baseline.SnapshotHasher;
import org.morm.migration.baseline.SnapshotStore;
import org.morm.migration.unit.MigrationUnit;
import org.morm.migration.unit.MigrationUnitRepository;
import org.morm.migration.unit.ModelLocks;
import org.morm.migration.unit.UnitHooks;
import org.morm.migration.unit.UnitState;
import org.morm.model.FieldSpec;
import org.morm.model.ModelDefinition;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MigrationRunnerTest {

    private static final String MODEL = "User";

    @TempDir
    Path tempDir;

    @Mock
    TransactionManager transactionManager;

    @Mock
    SqlExecutor executor;

    private MigrationUnitRepository repository;
    private SnapshotStore store;
    private MigrationRunner runner;
    private final ModelDefinition model = ModelDefinition.builder(MODEL).table("users").field("c1", "INT").build();

    @BeforeEach
    void setUp() throws Exception {
        repository = new MigrationUnitRepository(tempDir);
        store = new SnapshotStore(tempDir);
        runner = new MigrationRunner(repository, store, transactionManager, new ModelLocks(tempDir), new SnapshotHasher());
        when(transactionManager.inTransaction(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.doInTransaction(executor);
        });
    }

    private static SchemaSnapshot snapshotAt(long sequence) {
        List<FieldSpec> fields = new ArrayList<>();
        for (int i = 1; i <= sequence; i++) {
            fields.add(FieldSpec.of("c" + i, "INT"));
        }
        return SchemaSnapshot.of("users", fields, List.of());
    }

    private MigrationUnit unit(long sequence, UnitState state) {
        MigrationUnit unit = MigrationUnit.builder()
                .model(MODEL)
                .sequence(sequence)
                .state(state)
                .changeSet(ChangeSet.empty())
                .generatedSql(new ArrayList<>(List.of("S" + sequence)))
                .baselineHash(new SnapshotHasher().hash(sequence == 1 ? null : snapshotAt(sequence - 1)))
                .snapshot(snapshotAt(sequence))
                .build();
        repository.write(unit);
        return unit;
    }

    private UnitState stateOf(long sequence) {
        return repository.read(MODEL, sequence).orElseThrow().getState();
    }

    @Test
    @DisplayName("A failure on unit 3 of 5 keeps 1-2 applied, marks 3 failed and leaves 4-5 untouched")
    void failureHaltsModel() throws Exception {
        for (long seq = 1; seq <= 5; seq++) {
            unit(seq, UnitState.QUEUED);
        }
        doThrow(new SQLException("duplicate key value violates unique constraint")).when(executor).execute("S3");

        ModelApplyReport report = runner.apply(model);

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getAppliedSequences()).containsExactly(1L, 2L);
        assertThat(report.getFailedSequence()).isEqualTo(3L);
        assertThat(report.getSkippedSequences()).containsExactly(4L, 5L);
        assertThat(report.getFailure().getSequence()).isEqualTo(3);
        assertThat(report.getFailure().getMessage()).contains("#3").contains("duplicate key value");

        assertThat(stateOf(1)).isEqualTo(UnitState.APPLIED);
        assertThat(stateOf(2)).isEqualTo(UnitState.APPLIED);
        assertThat(stateOf(3)).isEqualTo(UnitState.FAILED);
        assertThat(repository.read(MODEL, 3).orElseThrow().getFailure()).contains("duplicate key value");
        assertThat(stateOf(4)).isEqualTo(UnitState.QUEUED);
        assertThat(stateOf(5)).isEqualTo(UnitState.QUEUED);
        verify(executor, never()).execute("S4");

        assertThat(store.lastAppliedSequence(MODEL)).isEqualTo(2);
        assertThat(store.load(MODEL)).isEqualTo(snapshotAt(2));
    }

    @Test
    @DisplayName("A failed unit is retried on the next run")
    void failedUnitIsRetried() throws Exception {
        unit(1, UnitState.QUEUED);
        unit(2, UnitState.QUEUED);
        doThrow(new SQLException("connection reset")).doNothing().when(executor).execute("S2");

        assertThat(runner.apply(model).isSuccess()).isFalse();
        ModelApplyReport second = runner.apply(model);

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.getAppliedSequences()).containsExactly(2L);
        assertThat(stateOf(2)).isEqualTo(UnitState.APPLIED);
        assertThat(repository.read(MODEL, 2).orElseThrow().getFailure()).isNull();
        assertThat(store.lastAppliedSequence(MODEL)).isEqualTo(2);
    }

    @Test
    @DisplayName("Nothing queued means nothing runs")
    void upToDate() {
        ModelApplyReport report = runner.apply(model);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getAppliedSequences()).isEmpty();
        assertThat(report.getLastAppliedSequence()).isZero();
    }

    @Test
    @DisplayName("Store ahead of the history is a consistency error")
    void storeAheadOfHistory() {
        unit(1, UnitState.APPLIED);
        unit(2, UnitState.QUEUED);
        store.save(MODEL, snapshotAt(2), 2);

        assertThatThrownBy(() -> runner.apply(model))
                .isInstanceOf(HistoryConsistencyException.class)
                .hasMessageContaining("records sequence 2 as applied but unit 2 is QUEUED");
    }

    @Test
    @DisplayName("An applied unit after a queued one is a consistency error")
    void appliedAfterQueued() {
        unit(1, UnitState.QUEUED);
        unit(2, UnitState.APPLIED);

        assertThatThrownBy(() -> runner.verifyHistory(MODEL))
                .isInstanceOf(HistoryConsistencyException.class)
                .hasMessageContaining("Unit 2 of model User is applied after unit 1");
    }

    @Test
    @DisplayName("An applied unit the store never saw advances the store instead of running again")
    void selfHealsStoreBehindHistory() throws Exception {
        unit(1, UnitState.APPLIED);
        unit(2, UnitState.QUEUED);

        ModelApplyReport report = runner.apply(model);

        assertThat(report.getAppliedSequences()).containsExactly(2L);
        verify(executor, never()).execute("S1");
        assertThat(store.lastAppliedSequence(MODEL)).isEqualTo(2);
    }

    @Test
    @DisplayName("Hook statements and hook class run around the generated SQL in the same transaction")
    void hooksRunInOrder() throws Exception {
        RecordingHook.CALLS.clear();
        MigrationUnit unit = unit(1, UnitState.QUEUED);
        unit.setHooks(UnitHooks.builder()
                .runBefore(List.of("BEFORE"))
                .runAfter(List.of("AFTER"))
                .hookClass(RecordingHook.class.getName())
                .build());
        repository.write(unit);

        ModelApplyReport report = runner.apply(model);

        assertThat(report.isSuccess()).isTrue();
        InOrder order = inOrder(executor);
        order.verify(executor).execute("BEFORE");
        order.verify(executor).execute("hook:before");
        order.verify(executor).execute("S1");
        order.verify(executor).execute("hook:after");
        order.verify(executor).execute("AFTER");
        order.verify(executor).execute(eq(AppliedHistory.INSERT_SQL), eq(MODEL), eq(1L), anyString());
        assertThat(RecordingHook.CALLS).containsExactly("before:User:1", "after:User:1");
    }

    @Test
    @DisplayName("An unknown hook class fails the unit")
    void unknownHookClass() throws Exception {
        MigrationUnit unit = unit(1, UnitState.QUEUED);
        unit.setHooks(UnitHooks.builder().hookClass("org.example.Missing").build());
        repository.write(unit);

        ModelApplyReport report = runner.apply(model);

        assertThat(report.getFailedSequence()).isEqualTo(1L);
        assertThat(stateOf(1)).isEqualTo(UnitState.FAILED);
        verify(executor, never()).execute("S1");
        verify(executor, never()).execute(eq(AppliedHistory.INSERT_SQL), any(), any(), any());
    }

    @Test
    @DisplayName("A unit the database recorded as committed is marked applied instead of running again")
    void committedUnitIsNotRunAgain() throws Exception {
        unit(1, UnitState.QUEUED);
        unit(2, UnitState.QUEUED);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("UNIT_SEQUENCE", 1L);
        row.put("APPLIED_AT", "2026-10-19T10:15:30");
        when(executor.fetch(eq(AppliedHistory.SELECT_SQL), eq(MODEL))).thenReturn(List.of(row));

        ModelApplyReport report = runner.apply(model);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getAppliedSequences()).containsExactly(2L);
        verify(executor, never()).execute("S1");
        verify(executor).execute("S2");
        MigrationUnit recovered = repository.read(MODEL, 1).orElseThrow();
        assertThat(recovered.getState()).isEqualTo(UnitState.APPLIED);
        assertThat(recovered.getAppliedAt()).isEqualTo("2026-10-19T10:15:30");
        assertThat(store.lastAppliedSequence(MODEL)).isEqualTo(2);
    }

    @Test
    @DisplayName("Checking the history also recovers units the database recorded as committed")
    void verifyHistoryRecoversCommittedUnit() throws Exception {
        MigrationUnit failed = unit(1, UnitState.FAILED);
        failed.setFailure("Unit User #1 failed: connection reset");
        repository.write(failed);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("unit_sequence", 1);
        row.put("applied_at", "2026-10-19T10:15:30");
        when(executor.fetch(eq(AppliedHistory.SELECT_SQL), eq(MODEL))).thenReturn(List.of(row));

        runner.verifyHistory(MODEL);

        assertThat(stateOf(1)).isEqualTo(UnitState.APPLIED);
        assertThat(repository.read(MODEL, 1).orElseThrow().getFailure()).isNull();
        assertThat(store.lastAppliedSequence(MODEL)).isEqualTo(1);
        assertThat(store.load(MODEL)).isEqualTo(snapshotAt(1));
    }

    @Test
    @DisplayName("Interruption between statements fails the unit and keeps the interrupt flag")
    void interruptionFailsUnit() throws Exception {
        MigrationUnit unit = unit(1, UnitState.QUEUED);
        unit.setGeneratedSql(List.of("FIRST", "SECOND"));
        repository.write(unit);
        doAnswer(inv -> {
            Thread.currentThread().interrupt();
            return null;
        }).when(executor).execute("FIRST");

        ModelApplyReport report;
        try {
            report = runner.apply(model);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(report.isSuccess()).isFalse();
        assertThat(stateOf(1)).isEqualTo(UnitState.FAILED);
        verify(executor, never()).execute("SECOND");
    }

    public static class RecordingHook implements MigrationHook {
        static final List<String> CALLS = new CopyOnWriteArrayList<>();

        @Override
        public void runBefore(HookContext context) throws Exception {
            CALLS.add("before:" + context.model().getName() + ":" + context.unit().getSequence());
            context.db().execute("hook:before");
        }

        @Override
        public void runAfter(HookContext context) throws Exception {
            CALLS.add("after:" + context.model().getName() + ":" + context.unit().getSequence());
            context.db().execute("hook:after");
        }
    }
}
