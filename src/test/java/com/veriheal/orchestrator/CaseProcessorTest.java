package com.veriheal.orchestrator;

import com.veriheal.core.checklist.ChecklistStore;
import com.veriheal.core.checklist.ExecutionRecord;
import com.veriheal.core.checklist.PatchRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.collaborator.GeneratedTest;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.diagnosis.SemanticAssessment;
import com.veriheal.core.escalation.EscalationReason;
import com.veriheal.core.escalation.Verdict;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchKind;
import com.veriheal.core.patch.PatchOrigin;
import com.veriheal.core.sandbox.SandboxResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.veriheal.orchestrator.HealingHarness.fail;
import static com.veriheal.orchestrator.HealingHarness.pass;
import static com.veriheal.orchestrator.HealingHarness.testCase;
import static org.junit.jupiter.api.Assertions.*;

class CaseProcessorTest {

    private static final String BROKEN_IMPORT = "import mathh\n\ndef sub(a, b):\n    return a - b\n";
    private static final String WRONG_SUB     = "def sub(a, b):\n    return a + b\n";
    private static final String MISSING_MODULE = "E   ModuleNotFoundError: No module named 'mathh'";

    @TempDir
    Path tempDir;

    private HealingHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new HealingHarness(tempDir, 3);
        harness.fileSystem.writeFile("tests/test_a.py", "from src.calc import sub\n\ndef test_sub():\n    assert sub(5, 3) == 2\n");
    }

    private ChecklistStore newRun(TestCase... cases) throws Exception {
        return harness.stores.create("run-1", List.of(cases));
    }

    private TestCase run(ChecklistStore store, String caseId) throws Exception {
        CaseOutcome outcome = harness.processor.process(store, caseId, () -> false);
        assertFalse(outcome.isFatal(), () -> "fatal: " + outcome.getFatalError());
        return store.find(caseId).orElseThrow();
    }

    /** Fails with a missing module until the import is fixed. */
    private void scriptMissingImport() {
        harness.sandbox.script = (selector, files, call) ->
                files.getOrDefault("src/calc.py", "").contains("mathh") ? fail(MISSING_MODULE) : pass();
        harness.collaborator.drafter = request -> request.getKind() == PatchKind.TARGETED_REPLACE
                ? Patch.targetedReplace(request.getTargetFile(), "import mathh", "import math", 0.9)
                : null;
    }

    // ================================================================
    // Happy paths
    // ================================================================

    @Test
    void testPassingTestGoesStraightToPassed() throws Exception {
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.PASSED, result.getStatus());
        assertEquals(0, result.getRetryCount());
        assertEquals(1, result.getExecutionHistory().size());
        assertTrue(result.getExecutionHistory().get(0).isPassed());
    }

    @Test
    void testMissingImportIsHealedWithTargetedReplace() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        scriptMissingImport();
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.PASSED, result.getStatus());
        assertEquals(1, result.getRetryCount());
        assertEquals(List.of("a-p1"), result.getPatchesApplied());
        PatchRecord patch = result.getPatchHistory().get(0);
        assertEquals(PatchKind.TARGETED_REPLACE, patch.getKind());
        assertFalse(patch.isRolledBack());
        assertEquals(DiagnosisCategory.IMPORT_OR_NAME_ERROR, result.getLastFailure().getCategory());
        assertTrue(harness.fileSystem.readFile("src/calc.py").startsWith("import math\n"));
        assertEquals(2, result.getExecutionHistory().size());

        String key = result.getLastFailure().getSignatureKey();
        assertEquals(1, harness.knowledgeBase.statsFor(key).getHealed());
    }

    @Test
    void testPassedCaseIsNeverReprocessed() throws Exception {
        ChecklistStore store = newRun(testCase("a").build());
        run(store, "a");
        int calls = harness.sandbox.calls.get();

        CaseOutcome again = harness.processor.process(store, "a", () -> false);

        assertEquals(TestCaseStatus.PASSED, again.getStatus());
        assertEquals(calls, harness.sandbox.calls.get());
    }

    @Test
    void testGeneratedTestIsWrittenBeforeVerification() throws Exception {
        harness.collaborator.generated = new GeneratedTest("def test_gen():\n    assert True\n", 0.9);
        harness.sandbox.script = (selector, files, call) ->
                files.containsKey("tests/test_gen.py") ? pass() : fail("E   file not found: " + selector);
        ChecklistStore store = newRun(testCase("gen").build());

        TestCase result = run(store, "gen");

        assertEquals(TestCaseStatus.PASSED, result.getStatus());
        assertEquals("def test_gen():\n    assert True\n", harness.fileSystem.readFile("tests/test_gen.py"));
        assertEquals(0.9, result.getGenerationConfidence(), 1e-9);
    }

    @Test
    void testEnvironmentFailureIsRetriedWithoutPatch() throws Exception {
        harness.sandbox.script = (selector, files, call) ->
                call == 1 ? SandboxResult.timedOut("", 1, 1000) : pass();
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.PASSED, result.getStatus());
        assertEquals(1, result.getRetryCount());
        assertTrue(result.getPatchesApplied().isEmpty());
        assertTrue(result.getExecutionHistory().get(0).isTimedOut());
        assertTrue(harness.collaborator.requests.isEmpty());
    }

    // ================================================================
    // Retry bound and escalation
    // ================================================================

    @Test
    void testRetryBoundEscalatesAndRollsBack() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", WRONG_SUB);
        harness.semanticAnswer = new SemanticAssessment(DiagnosisCategory.ASSERTION_MISMATCH,
                FailureScope.MULTI_LINE, 0.8, "src/calc.py", "sub adds");
        harness.sandbox.script = (selector, files, call) -> fail("E   AssertionError: assert 8 == 2");
        AtomicInteger attempt = new AtomicInteger();
        harness.collaborator.drafter = request -> request.getKind() == PatchKind.FULL_REWRITE
                ? Patch.fullRewrite(request.getTargetFile(),
                        "def sub(a, b):\n    return a * b  # attempt " + attempt.incrementAndGet() + "\n", 0.7)
                : null;
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.RETRIES_EXHAUSTED, result.getEscalation().getReason());
        assertEquals(3, result.getRetryCount());
        assertEquals(3, result.getPatchesApplied().size());
        assertTrue(result.getPatchHistory().stream().allMatch(PatchRecord::isRolledBack));
        assertEquals(WRONG_SUB, harness.fileSystem.readFile("src/calc.py"));
        assertEquals(4, harness.sandbox.calls.get());
        assertEquals(1, harness.knowledgeBase.statsFor(result.getLastFailure().getSignatureKey()).getEscalated());
    }

    private static final String TWO_BUGS =
            "def sub(a, b):\n    return a + b\n\n\ndef mul(a, b):\n    return a + b\n";

    /** Drafts a diff for sub(); fails every verification. */
    private void scriptFailingSubDiff() {
        harness.semanticAnswer = new SemanticAssessment(DiagnosisCategory.ASSERTION_MISMATCH,
                FailureScope.MULTI_LINE, 0.8, "src/calc.py", "sub adds");
        AtomicInteger attempt = new AtomicInteger();
        harness.collaborator.drafter = request -> request.getKind() == PatchKind.UNIFIED_DIFF
                ? Patch.unifiedDiff(request.getTargetFile(),
                        "@@ -1,2 +1,2 @@\n def sub(a, b):\n-    return a + b\n+    return a * b  # attempt "
                                + attempt.incrementAndGet() + "\n", 0.8)
                : null;
    }

    @Test
    void testRollbackKeepsAnotherCasesPatchToTheSameFile() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", TWO_BUGS);
        scriptFailingSubDiff();
        ChecklistStore store = newRun(testCase("a").build(), testCase("b").build());
        TestCase other = store.find("b").orElseThrow();

        harness.sandbox.script = (selector, files, call) -> {
            if (call == 2) {
                // b's fix lands while a's first patch is being verified
                try {
                    harness.patchEngine.apply(Patch.targetedReplace("src/calc.py",
                            "def mul(a, b):\n    return a + b", "def mul(a, b):\n    return a * b", 0.9), other);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }
            return fail("E   AssertionError: assert 8 == 2");
        };

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.RETRIES_EXHAUSTED, result.getEscalation().getReason());
        assertTrue(result.getPatchHistory().stream().allMatch(PatchRecord::isRolledBack));
        assertEquals("def sub(a, b):\n    return a + b\n\n\ndef mul(a, b):\n    return a * b\n",
                harness.fileSystem.readFile("src/calc.py"));
    }

    @Test
    void testRollbackConflictEscalates() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", TWO_BUGS);
        scriptFailingSubDiff();
        ChecklistStore store = newRun(testCase("a").build());
        String edited = "def sub(a, b):\n    return a - b  # edited by hand\n\n\ndef mul(a, b):\n    return a + b\n";

        harness.sandbox.script = (selector, files, call) -> {
            if (call == 2) {
                try {
                    harness.fileSystem.writeFile("src/calc.py", edited);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }
            return fail("E   AssertionError: assert 8 == 2");
        };

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.ROLLBACK_CONFLICT, result.getEscalation().getReason());
        assertEquals(1, result.getPatchesApplied().size());
        assertFalse(result.getPatchHistory().get(0).isRolledBack());
        assertEquals(edited, harness.fileSystem.readFile("src/calc.py"));
        assertEquals(2, harness.sandbox.calls.get());
    }

    @Test
    void testLowConfidenceEscalatesWithoutPatching() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", WRONG_SUB);
        harness.sandbox.script = (selector, files, call) -> fail("E   AssertionError: assert 8 == 2");
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.LOW_CONFIDENCE, result.getEscalation().getReason());
        assertEquals(0, result.getRetryCount());
        assertTrue(harness.collaborator.requests.isEmpty());
    }

    @Test
    void testQualityGateRejectionSkipsSandbox() throws Exception {
        String tooLong = "x = 1\n".repeat(80);
        ChecklistStore store = newRun(testCase("a").testCode(tooLong).generationConfidence(0.99).build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.LOW_CONFIDENCE, result.getEscalation().getReason());
        assertEquals(0, harness.sandbox.calls.get());
        ExecutionRecord record = result.getExecutionHistory().get(0);
        assertTrue(record.getGateFailure().startsWith("Code complexity too high"));
    }

    @Test
    void testRejectedDraftsClimbTheKindLadder() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        harness.sandbox.script = (selector, files, call) -> fail(MISSING_MODULE);
        harness.collaborator.drafter = request -> request.getKind() == PatchKind.TARGETED_REPLACE
                ? Patch.targetedReplace(request.getTargetFile(), "import numpy", "import math", 0.9)
                : null;
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.PATCH_VALIDATION_FAILED, result.getEscalation().getReason());
        assertEquals(List.of(PatchKind.TARGETED_REPLACE, PatchKind.UNIFIED_DIFF, PatchKind.FULL_REWRITE),
                harness.collaborator.requests.stream().map(r -> r.getKind()).toList());
        assertNotNull(harness.collaborator.requests.get(1).getPreviousRejection());
        assertEquals(BROKEN_IMPORT, harness.fileSystem.readFile("src/calc.py"));
        assertEquals(0, result.getRetryCount());
    }

    @Test
    void testNoDraftEscalatesAsNoViablePatch() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        harness.sandbox.script = (selector, files, call) -> fail(MISSING_MODULE);
        ChecklistStore store = newRun(testCase("a").build());

        TestCase result = run(store, "a");

        assertEquals(EscalationReason.NO_VIABLE_PATCH, result.getEscalation().getReason());
    }

    // ================================================================
    // Manual resolution
    // ================================================================

    @Test
    void testManualFixIsAppliedWithoutConsumingRetry() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", WRONG_SUB);
        harness.sandbox.script = (selector, files, call) ->
                files.get("src/calc.py").contains("a - b") ? pass() : fail("E   AssertionError: assert 8 == 2");
        ChecklistStore store = newRun(testCase("a").build());
        assertEquals(TestCaseStatus.ESCALATED, run(store, "a").getStatus());

        harness.escalations.resolve("run-1", "a", Verdict.FIX,
                Patch.fullRewrite("src/calc.py", "def sub(a, b):\n    return a - b\n", 1.0), "fixed by reviewer");
        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.PASSED, result.getStatus());
        assertEquals(0, result.getRetryCount());
        assertEquals(PatchOrigin.MANUAL, result.getPatchHistory().get(0).getOrigin());
        assertNull(result.getPendingPatch());
        assertFalse(result.isManualFixPending());
    }

    @Test
    void testInvalidManualPatchEscalatesAgain() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", WRONG_SUB);
        harness.sandbox.script = (selector, files, call) -> fail("E   AssertionError: assert 8 == 2");
        ChecklistStore store = newRun(testCase("a").build());
        run(store, "a");

        harness.escalations.resolve("run-1", "a", Verdict.FIX,
                Patch.targetedReplace("src/calc.py", "not in file", "x", 1.0), null);
        TestCase result = run(store, "a");

        assertEquals(TestCaseStatus.ESCALATED, result.getStatus());
        assertEquals(EscalationReason.MANUAL_PATCH_REJECTED, result.getEscalation().getReason());
        assertEquals(WRONG_SUB, harness.fileSystem.readFile("src/calc.py"));
    }

    // ================================================================
    // Cancellation and resume
    // ================================================================

    @Test
    void testCancelledCaseResumesToSameOutcome() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        scriptMissingImport();
        ChecklistStore store = newRun(testCase("a").build());

        AtomicInteger checks = new AtomicInteger();
        CaseOutcome first = harness.processor.process(store, "a", () -> checks.incrementAndGet() > 4);
        assertTrue(first.isCancelled());
        assertFalse(store.find("a").orElseThrow().getStatus().isTerminalForScheduling());

        TestCase resumed = run(store, "a");

        HealingHarness fresh = new HealingHarness(tempDir.resolve("uninterrupted"), 3);
        fresh.fileSystem.writeFile("tests/test_a.py", harness.fileSystem.readFile("tests/test_a.py"));
        fresh.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        fresh.sandbox.script = harness.sandbox.script;
        fresh.collaborator.drafter = harness.collaborator.drafter;
        ChecklistStore freshStore = fresh.stores.create("run-1", List.of(testCase("a").build()));
        fresh.processor.process(freshStore, "a", () -> false);
        TestCase uninterrupted = freshStore.find("a").orElseThrow();

        assertEquals(uninterrupted.getStatus(), resumed.getStatus());
        assertEquals(uninterrupted.getRetryCount(), resumed.getRetryCount());
        assertEquals(uninterrupted.getPatchesApplied(), resumed.getPatchesApplied());
        assertEquals(uninterrupted.getExecutionHistory().size(), resumed.getExecutionHistory().size());
        assertEquals(fresh.fileSystem.readFile("src/calc.py"), harness.fileSystem.readFile("src/calc.py"));
    }

    @Test
    void testUnknownCaseIsRejected() throws Exception {
        ChecklistStore store = newRun(testCase("a").build());

        assertThrows(IllegalArgumentException.class, () -> harness.processor.process(store, "zzz", () -> false));
    }

    @Test
    void testLearnedEscalationsLowerLaterConfidence() throws Exception {
        harness.fileSystem.writeFile("src/calc.py", BROKEN_IMPORT);
        harness.sandbox.script = (selector, files, call) -> fail(MISSING_MODULE);
        TestCase first = run(newRun(testCase("a").build()), "a");
        assertEquals(EscalationReason.NO_VIABLE_PATCH, first.getEscalation().getReason());
        assertEquals(0.9, first.getLastFailure().getConfidence(), 1e-9);

        ChecklistStore second = harness.stores.create("run-2", List.of(testCase("a").build()));
        CaseOutcome outcome = harness.processor.process(second, "a", () -> false);

        assertEquals(TestCaseStatus.ESCALATED, outcome.getStatus());
        assertEquals(0.8, second.find("a").orElseThrow().getLastFailure().getConfidence(), 1e-9);
    }
}
