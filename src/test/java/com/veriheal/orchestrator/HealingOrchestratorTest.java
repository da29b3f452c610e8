package com.veriheal.orchestrator;

import com.veriheal.core.checklist.ChecklistStore;
import com.veriheal.core.checklist.ChecklistStoreException;
import com.veriheal.core.checklist.ChecklistStoreFactory;
import com.veriheal.core.checklist.ExecutionRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.diagnosis.SemanticAssessment;
import com.veriheal.core.escalation.EscalationReason;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.patch.FileLockManager;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.veriheal.orchestrator.HealingHarness.fail;
import static com.veriheal.orchestrator.HealingHarness.pass;
import static com.veriheal.orchestrator.HealingHarness.testCase;
import static org.junit.jupiter.api.Assertions.*;

class HealingOrchestratorTest {

    @TempDir
    Path tempDir;

    private HealingHarness harness;

    @BeforeEach
    void setUp() {
        harness = new HealingHarness(tempDir, 3);
    }

    // ================================================================
    // Scheduling
    // ================================================================

    @Test
    void testHigherPriorityRunsFirst() throws Exception {
        RunSummary summary = harness.orchestrator(1).runOnce("run-prio", List.of(
                testCase("low").priority(1).build(),
                testCase("high").priority(9).build(),
                testCase("mid").priority(5).build()));

        assertEquals(3, summary.getPassing());
        assertEquals(List.of("tests/test_high.py", "tests/test_mid.py", "tests/test_low.py"),
                harness.sandbox.selectors);
    }

    @Test
    void testDependentRunsAfterPrerequisitePasses() throws Exception {
        RunSummary summary = harness.orchestrator(2).runOnce("run-deps", List.of(
                testCase("b").dependsOn("a").priority(9).build(),
                testCase("a").build()));

        assertEquals(2, summary.count(TestCaseStatus.PASSED));
        assertEquals(List.of("tests/test_a.py", "tests/test_b.py"), harness.sandbox.selectors);
        assertEquals(0, summary.exitCode(true));
    }

    @Test
    void testDependentOfEscalatedCaseStaysBlocked() throws Exception {
        harness.sandbox.script = (selector, files, call) ->
                selector.contains("test_a") ? fail("E   AssertionError: assert 8 == 2") : pass();

        RunSummary summary = harness.orchestrator(2).runOnce("run-blocked", List.of(
                testCase("a").build(),
                testCase("b").dependsOn("a").build(),
                testCase("c").build()));

        assertEquals(3, summary.getTotal());
        assertEquals(1, summary.count(TestCaseStatus.ESCALATED));
        assertEquals(1, summary.count(TestCaseStatus.PENDING));
        assertEquals(1, summary.count(TestCaseStatus.PASSED));
        assertEquals(1, summary.getEscalationReasons().get(EscalationReason.LOW_CONFIDENCE));
        assertEquals(List.of("b"), summary.getBlocked());
        assertFalse(summary.isCancelled());
        assertEquals(1, summary.exitCode(true));
        assertEquals(0, summary.exitCode(false));
        assertFalse(harness.sandbox.selectors.contains("tests/test_b.py"));
    }

    @Test
    void testSelectEligibleOrdersAndFilters() throws Exception {
        List<TestCase> cases = harness.stores.create("run-select", List.of(
                testCase("a").priority(1).build(),
                testCase("b").priority(5).dependsOn("a").build(),
                testCase("c").priority(5).build(),
                testCase("d").priority(9).build())).load();

        List<String> eligible = ids(HealingOrchestrator.selectEligible(cases, Set.of("d"), Set.of()));
        assertEquals(List.of("c", "a"), eligible);

        assertEquals(List.of("d", "a"), ids(HealingOrchestrator.selectEligible(cases, Set.of(), Set.of("c"))));
    }

    // ================================================================
    // Shared files
    // ================================================================

    @Test
    void testConcurrentFixesToSameFileBothLand() throws Exception {
        harness.fileSystem.writeFile("src/shared.py", "x = 1\ny = 1\n");
        harness.semanticAnswer = new SemanticAssessment(DiagnosisCategory.ASSERTION_MISMATCH,
                FailureScope.MULTI_LINE, 0.8, "src/shared.py", "constant is wrong");
        harness.sandbox.script = (selector, files, call) -> {
            String shared = files.get("src/shared.py");
            boolean fixed = selector.contains("left") ? shared.contains("x = 2") : shared.contains("y = 2");
            return fixed ? pass() : fail("E   AssertionError: assert 1 == 2");
        };
        harness.collaborator.drafter = request -> {
            boolean left = request.getCaseId().equals("left");
            String name  = left ? "x" : "y";
            int line     = left ? 1 : 2;
            if (request.getKind() == PatchKind.TARGETED_REPLACE) {
                return Patch.targetedReplace(request.getTargetFile(), name + " = 1", name + " = 2", 0.9);
            }
            if (request.getKind() == PatchKind.UNIFIED_DIFF) {
                return Patch.unifiedDiff(request.getTargetFile(),
                        "@@ -" + line + ",1 +" + line + ",1 @@\n-" + name + " = 1\n+" + name + " = 2\n", 0.9);
            }
            return null;
        };

        RunSummary summary = harness.orchestrator(2).runOnce("run-shared", List.of(
                testCase("left").targetFile("src/shared.py").build(),
                testCase("right").targetFile("src/shared.py").build()));

        assertEquals(2, summary.getPassing());
        assertEquals("x = 2\ny = 2\n", harness.fileSystem.readFile("src/shared.py"));
    }

    // ================================================================
    // Cancellation and resume
    // ================================================================

    @Test
    void testCancelStopsSchedulingAndResumeFinishes() throws Exception {
        HealingOrchestrator orchestrator = harness.orchestrator(1);
        harness.sandbox.script = (selector, files, call) -> {
            if (call == 1) assertTrue(orchestrator.cancel("run-cancel"));
            return pass();
        };

        RunSummary first = orchestrator.runOnce("run-cancel", List.of(
                testCase("a").priority(3).build(),
                testCase("b").priority(2).build(),
                testCase("c").priority(1).build()));

        assertTrue(first.isCancelled());
        assertEquals(1, first.count(TestCaseStatus.PASSED));
        assertEquals(2, first.count(TestCaseStatus.PENDING));
        assertEquals(2, first.getUnfinished());
        assertFalse(orchestrator.isActive("run-cancel"));

        harness.sandbox.script = (selector, files, call) -> pass();
        RunSummary second = orchestrator.resume("run-cancel");

        assertFalse(second.isCancelled());
        assertEquals(3, second.getPassing());
        assertEquals(3, harness.sandbox.calls.get());
    }

    @Test
    void testResumeAfterRestartContinuesFromDisk() throws Exception {
        HealingOrchestrator orchestrator = harness.orchestrator(1);
        harness.sandbox.script = (selector, files, call) -> {
            orchestrator.cancel("run-restart");
            return pass();
        };
        orchestrator.runOnce("run-restart", List.of(testCase("a").priority(2).build(), testCase("b").build()));

        HealingHarness restarted = new HealingHarness(tempDir, 3);
        RunSummary summary = restarted.orchestrator(1).resume("run-restart");

        assertEquals(2, summary.getPassing());
        assertEquals(List.of("tests/test_b.py"), restarted.sandbox.selectors);
    }

    @Test
    void testCancelOfIdleRunIsRefused() {
        assertFalse(harness.orchestrator(1).cancel("run-nothing"));
    }

    // ================================================================
    // Errors
    // ================================================================

    @Test
    void testUnexpectedErrorAbortsOnlyThatCase() throws Exception {
        harness.sandbox.script = (selector, files, call) -> {
            if (selector.contains("boom")) throw new IllegalStateException("sandbox exploded");
            return pass();
        };

        RunSummary summary = harness.orchestrator(2).runOnce("run-fatal", List.of(
                testCase("boom").build(),
                testCase("fine").build()));

        assertEquals(1, summary.getPassing());
        assertTrue(summary.getFatal().containsKey("boom"));
        assertTrue(summary.getFatal().get("boom").contains("sandbox exploded"));
        assertEquals(1, summary.exitCode(true));
    }

    @Test
    void testChecklistWriteFailureAbortsOnlyThatCase() throws Exception {
        ChecklistStoreFactory failing = new ChecklistStoreFactory(tempDir.resolve("failing-runs").toString()) {
            @Override
            public synchronized ChecklistStore create(String runId, List<TestCase> batch)
                    throws ChecklistStoreException {
                return new SaveFailsFor("broken", super.create(runId, batch));
            }
        };

        RunSummary summary = new HealingOrchestrator(failing, harness.processor, harness.eventBus, 2)
                .runOnce("run-store", List.of(
                        testCase("broken").build(),
                        testCase("fine").build()));

        assertEquals(1, summary.getPassing());
        assertEquals(Set.of("broken"), summary.getFatal().keySet());
        assertTrue(summary.getFatal().get("broken").contains("disk full"));
        assertEquals(List.of("tests/test_fine.py"), harness.sandbox.selectors);
    }

    @Test
    void testLockTimeoutAbortsOnlyThatCase() throws Exception {
        HealingHarness impatient = new HealingHarness(tempDir.resolve("impatient"), 3, 100);
        impatient.fileSystem.writeFile("src/calc.py", "def sub(a, b):\n    return a + b\n");
        impatient.semanticAnswer = new SemanticAssessment(DiagnosisCategory.ASSERTION_MISMATCH,
                FailureScope.MULTI_LINE, 0.8, "src/calc.py", "sub adds");
        impatient.collaborator.drafter = request -> request.getKind() == PatchKind.UNIFIED_DIFF
                ? Patch.unifiedDiff(request.getTargetFile(),
                        "@@ -1,2 +1,2 @@\n def sub(a, b):\n-    return a + b\n+    return a - b\n", 0.8)
                : null;
        impatient.sandbox.script = (selector, files, call) ->
                selector.contains("locked") ? fail("E   AssertionError: assert 8 == 2") : pass();

        RunSummary summary;
        try (FileLockManager.Lease held = impatient.locks.acquire(impatient.fileSystem.normalize("src/calc.py"))) {
            summary = impatient.orchestrator(2).runOnce("run-lock", List.of(
                    testCase("locked").build(),
                    testCase("fine").build()));
        }

        assertEquals(1, summary.getPassing());
        assertEquals(Set.of("locked"), summary.getFatal().keySet());
        assertTrue(summary.getFatal().get("locked").contains("waiting for lock"));
        assertEquals(TestCaseStatus.HEALING,
                impatient.stores.open("run-lock").find("locked").orElseThrow().getStatus());
        assertEquals("def sub(a, b):\n    return a + b\n", impatient.fileSystem.readFile("src/calc.py"));
    }

    @Test
    void testResumeOfUnknownRunIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> harness.orchestrator(1).resume("run-missing"));
    }

    @Test
    void testDuplicateRunIdIsRejected() throws Exception {
        HealingOrchestrator orchestrator = harness.orchestrator(1);
        orchestrator.runOnce("run-dup", List.of(testCase("a").build()));

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.runOnce("run-dup", List.of(testCase("a").build())));
    }

    @Test
    void testWorkerCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> harness.orchestrator(0));
    }

    @Test
    void testRunEventsBracketCaseTransitions() throws Exception {
        AtomicReference<RunSummary> published = new AtomicReference<>();
        harness.eventBus.subscribe(event -> {
            if (event.getType() == EventType.RUN_FINISHED) published.set(event.getPayload(RunSummary.class));
        });

        RunSummary summary = harness.orchestrator(1).runOnce("run-events", List.of(testCase("a").build()));

        List<EventType> types = harness.events.stream().map(Event::getType).collect(Collectors.toList());
        assertEquals(EventType.RUN_STARTED, types.get(0));
        assertEquals(EventType.RUN_FINISHED, types.get(types.size() - 1));
        assertTrue(types.contains(EventType.CASE_TRANSITION));
        assertSame(summary, published.get());
    }

    private static List<String> ids(List<TestCase> cases) {
        return cases.stream().map(TestCase::getId).collect(Collectors.toList());
    }

    /** Delegates to a real store but refuses to save one case. */
    private static final class SaveFailsFor implements ChecklistStore {
        private final String         caseId;
        private final ChecklistStore delegate;

        SaveFailsFor(String caseId, ChecklistStore delegate) {
            this.caseId   = caseId;
            this.delegate = delegate;
        }

        @Override
        public String runId() {
            return delegate.runId();
        }

        @Override
        public List<TestCase> load() throws ChecklistStoreException {
            return delegate.load();
        }

        @Override
        public Optional<TestCase> find(String id) throws ChecklistStoreException {
            return delegate.find(id);
        }

        @Override
        public void save(TestCase testCase) throws ChecklistStoreException {
            if (testCase.getId().equals(caseId)) {
                throw new ChecklistStoreException("disk full while writing " + caseId);
            }
            delegate.save(testCase);
        }

        @Override
        public void appendExecutionRecord(String id, ExecutionRecord record) throws ChecklistStoreException {
            delegate.appendExecutionRecord(id, record);
        }
    }
}
