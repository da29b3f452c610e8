package com.veriheal.core.checklist;

import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.escalation.EscalationReason;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonChecklistStoreTest {

    @TempDir
    Path tempDir;

    private Path file;
    private JsonChecklistStore store;

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("run-1.json");
        store = JsonChecklistStore.create("run-1", file, List.of(
                TestCase.builder("a").testFile("tests/test_a.py").priority(1).build(),
                TestCase.builder("b").testFile("tests/test_b.py").dependsOn("a").build()));
    }

    @Test
    void testCreateAssignsSequenceAndRun() {
        List<TestCase> cases = store.load();

        assertEquals(2, cases.size());
        assertEquals("a", cases.get(0).getId());
        assertEquals(0, cases.get(0).getSequence());
        assertEquals(1, cases.get(1).getSequence());
        assertEquals("run-1", cases.get(1).getRunId());
        assertEquals(List.of("a"), cases.get(1).getDependsOn());
        assertTrue(Files.exists(file));
    }

    @Test
    void testCreateResetsRuntimeState() throws Exception {
        TestCase dirty = TestCase.builder("x").testFile("t.py").build();
        dirty.transitionTo(TestCaseStatus.GENERATING);
        dirty.incrementRetry();

        JsonChecklistStore other = JsonChecklistStore.create("run-2", tempDir.resolve("run-2.json"), List.of(dirty));

        TestCase stored = other.find("x").orElseThrow();
        assertEquals(TestCaseStatus.PENDING, stored.getStatus());
        assertEquals(0, stored.getRetryCount());
    }

    @Test
    void testCreateRefusesExistingRun() {
        assertThrows(IllegalArgumentException.class, () -> JsonChecklistStore.create("run-1", file,
                List.of(TestCase.builder("z").testFile("t.py").build())));
    }

    @Test
    void testSaveSurvivesReopen() throws Exception {
        TestCase a = store.find("a").orElseThrow();
        a.transitionTo(TestCaseStatus.GENERATING);
        a.transitionTo(TestCaseStatus.VERIFYING);
        a.transitionTo(TestCaseStatus.FAILED);
        a.recordFailure(FailureRecord.undiagnosed("E   AssertionError", 1, false)
                .withDiagnosis(DiagnosisCategory.ASSERTION_MISMATCH, FailureScope.MULTI_LINE, 0.8,
                        PatchKind.UNIFIED_DIFF, "src/a.py", null, "AssertionError: ", "mismatch"));
        a.transitionTo(TestCaseStatus.ESCALATED);
        a.setEscalation(EscalationInfo.open(EscalationReason.LOW_CONFIDENCE, "below floor"));
        a.setPendingPatch(Patch.fullRewrite("src/a.py", "x = 1\n", 0.5), true);
        store.save(a);

        JsonChecklistStore reopened = JsonChecklistStore.open("run-1", file);
        TestCase loaded = reopened.find("a").orElseThrow();

        assertEquals(TestCaseStatus.ESCALATED, loaded.getStatus());
        assertEquals(EscalationReason.LOW_CONFIDENCE, loaded.getEscalation().getReason());
        assertEquals(DiagnosisCategory.ASSERTION_MISMATCH, loaded.getLastFailure().getCategory());
        assertEquals("x = 1\n", loaded.getPendingPatch().getContent());
        assertTrue(loaded.isManualFixPending());
        assertEquals(List.of("a", "b"), reopened.load().stream().map(TestCase::getId).toList());
    }

    @Test
    void testPassedCaseCannotBeOverwritten() throws Exception {
        TestCase a = store.find("a").orElseThrow();
        TestCase stale = a.copy();
        a.transitionTo(TestCaseStatus.GENERATING);
        a.transitionTo(TestCaseStatus.VERIFYING);
        a.transitionTo(TestCaseStatus.PASSED);
        store.save(a);

        stale.transitionTo(TestCaseStatus.GENERATING);
        assertThrows(IllegalStateException.class, () -> store.save(stale));
        assertEquals(TestCaseStatus.PASSED, store.find("a").orElseThrow().getStatus());
    }

    @Test
    void testExecutionRecordsAreIdempotentAndMerged() throws Exception {
        TestCase heldByWorker = store.find("a").orElseThrow();

        ExecutionRecord first = ExecutionRecord.sandbox("a", 1, false, false, 12, "", "boom");
        store.appendExecutionRecord("a", first);
        store.appendExecutionRecord("a", first);

        // the worker's copy predates the record; saving it must not drop it
        heldByWorker.transitionTo(TestCaseStatus.GENERATING);
        store.save(heldByWorker);

        TestCase stored = store.find("a").orElseThrow();
        assertEquals(TestCaseStatus.GENERATING, stored.getStatus());
        assertEquals(1, stored.getExecutionHistory().size());
        assertEquals(2, stored.nextAttemptNumber());
    }

    @Test
    void testUnknownCaseIsRejected() {
        TestCase stranger = TestCase.builder("nope").testFile("t.py").build();

        assertThrows(IllegalArgumentException.class, () -> store.save(stranger));
        assertThrows(IllegalArgumentException.class,
                () -> store.appendExecutionRecord("nope", ExecutionRecord.sandbox("nope", 1, true, false, 1, "", "")));
    }

    @Test
    void testOpenUnknownRun() {
        assertThrows(IllegalArgumentException.class,
                () -> JsonChecklistStore.open("missing", tempDir.resolve("missing.json")));
    }

    @Test
    void testCorruptFileIsStoreError() throws Exception {
        Path corrupt = tempDir.resolve("bad.json");
        Files.writeString(corrupt, "{ not json");

        assertThrows(ChecklistStoreException.class, () -> JsonChecklistStore.open("bad", corrupt));
    }

    @Test
    void testNoTempFilesLeftBehind() throws Exception {
        TestCase a = store.find("a").orElseThrow();
        a.transitionTo(TestCaseStatus.GENERATING);
        store.save(a);

        try (var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}
