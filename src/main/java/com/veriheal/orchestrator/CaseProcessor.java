package com.veriheal.orchestrator;

import com.veriheal.communication.EventBus;
import com.veriheal.core.checklist.ChecklistStore;
import com.veriheal.core.checklist.ChecklistStoreException;
import com.veriheal.core.checklist.ExecutionRecord;
import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.collaborator.GeneratedTest;
import com.veriheal.core.collaborator.HealingCollaborator;
import com.veriheal.core.collaborator.PatchRequest;
import com.veriheal.core.diagnosis.Diagnosis;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.DiagnosisClassifier;
import com.veriheal.core.diagnosis.TestMetadata;
import com.veriheal.core.escalation.EscalationController;
import com.veriheal.core.escalation.EscalationReason;
import com.veriheal.core.event.CaseTransition;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.filesystem.FileSystemManager;
import com.veriheal.core.filesystem.FileSystemManager.FileSystemException;
import com.veriheal.core.filesystem.FileSystemManager.WorkspaceSnapshot;
import com.veriheal.core.gate.GateResult;
import com.veriheal.core.gate.QualityGate;
import com.veriheal.core.patch.AppliedPatch;
import com.veriheal.core.patch.FileLockManager;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchEngine;
import com.veriheal.core.patch.PatchException;
import com.veriheal.core.patch.PatchKind;
import com.veriheal.core.patch.PatchLockTimeoutException;
import com.veriheal.core.patch.PatchOrigin;
import com.veriheal.core.patch.PatchValidationException;
import com.veriheal.core.sandbox.SandboxException;
import com.veriheal.core.sandbox.SandboxResult;
import com.veriheal.core.sandbox.SandboxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Drives a single test case through its state machine until it reaches a
 * status only a human can move it out of.
 *
 * Each step loads nothing but the working copy, does its work, and commits
 * the resulting transition to the store before the next step begins. A case
 * interrupted at any point therefore resumes from its last committed status.
 * Cancellation is honoured between steps only.
 */
@Component
public class CaseProcessor {

    private static final Logger log = LoggerFactory.getLogger(CaseProcessor.class);

    private final FileSystemManager    fileSystem;
    private final FileLockManager      locks;
    private final PatchEngine          patchEngine;
    private final SandboxRunner        sandbox;
    private final DiagnosisClassifier  classifier;
    private final QualityGate          qualityGate;
    private final HealingCollaborator  collaborator;
    private final EscalationController escalations;
    private final EventBus             eventBus;
    private final int                  maxRetries;
    private final boolean              rollbackFailedPatches;

    public CaseProcessor(
            FileSystemManager fileSystem,
            FileLockManager locks,
            PatchEngine patchEngine,
            SandboxRunner sandbox,
            DiagnosisClassifier classifier,
            QualityGate qualityGate,
            HealingCollaborator collaborator,
            EscalationController escalations,
            EventBus eventBus,
            @Value("${veriheal.healing.max-retries:3}") int maxRetries,
            @Value("${veriheal.healing.rollback-failed-patches:true}") boolean rollbackFailedPatches
    ) {
        this.fileSystem            = fileSystem;
        this.locks                 = locks;
        this.patchEngine           = patchEngine;
        this.sandbox               = sandbox;
        this.classifier            = classifier;
        this.qualityGate           = qualityGate;
        this.collaborator          = collaborator;
        this.escalations           = escalations;
        this.eventBus              = eventBus;
        this.maxRetries            = maxRetries;
        this.rollbackFailedPatches = rollbackFailedPatches;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    // =========================================================================
    // MAIN LOOP
    // =========================================================================

    CaseOutcome process(ChecklistStore store, String caseId, BooleanSupplier cancelled)
            throws FatalCaseException {

        TestCase testCase = load(store, caseId);
        // automated patch applied by the last healing step; lives only in this worker
        AppliedPatch lastApplied = null;

        try {
            while (!testCase.getStatus().isTerminalForScheduling()) {
                if (cancelled.getAsBoolean()) {
                    log.info("[CaseProcessor] {} stopped by cancellation at {}", caseId, testCase.getStatus());
                    return CaseOutcome.cancelled(caseId, testCase.getStatus());
                }

                switch (testCase.getStatus()) {
                    case PENDING:
                        commit(store, testCase, TestCaseStatus.GENERATING);
                        break;
                    case GENERATING:
                        generate(store, testCase);
                        break;
                    case VERIFYING:
                        verify(store, testCase, lastApplied);
                        lastApplied = null;
                        break;
                    case FAILED:
                        diagnose(store, testCase);
                        break;
                    case HEALING:
                        lastApplied = heal(store, testCase);
                        break;
                    default:
                        throw new IllegalStateException("Unexpected status " + testCase.getStatus());
                }
            }
        } catch (ChecklistStoreException e) {
            throw new FatalCaseException(caseId, "Checklist store unavailable: " + e.getMessage(), e);
        } catch (PatchLockTimeoutException e) {
            throw new FatalCaseException(caseId, e.getMessage(), e);
        }

        log.info("[CaseProcessor] {} finished as {}", caseId, testCase.getStatus());
        return CaseOutcome.finished(caseId, testCase.getStatus());
    }

    // =========================================================================
    // GENERATING
    // =========================================================================

    private void generate(ChecklistStore store, TestCase testCase)
            throws ChecklistStoreException, PatchLockTimeoutException, FatalCaseException {

        String testFile = testCase.getTestFile();
        String code     = testCase.getTestCode();

        if (code == null && testFile != null && !fileSystem.fileExists(testFile)) {
            Optional<GeneratedTest> generated = collaborator.generateTest(testCase);
            if (generated.isPresent()) {
                code = generated.get().getCode();
                testCase.recordGeneratedTest(code, generated.get().getConfidence());
                log.info("[CaseProcessor] Generated {} lines of test code for {} (confidence {})",
                        code.split("\\R", -1).length, testCase.getId(), generated.get().getConfidence());
            } else {
                log.warn("[CaseProcessor] No test code for {}; verification will report the missing file",
                        testCase.getId());
            }
        }

        if (code != null && testFile != null) {
            writeTestFile(testCase, testFile, code);
        }
        commit(store, testCase, TestCaseStatus.VERIFYING);
    }

    private void writeTestFile(TestCase testCase, String testFile, String code)
            throws PatchLockTimeoutException, FatalCaseException {
        try {
            String key = fileSystem.normalize(testFile);
            try (FileLockManager.Lease lease = locks.acquire(key)) {
                if (fileSystem.fileExists(key) && fileSystem.readFile(key).equals(code)) {
                    return;
                }
                fileSystem.writeFile(key, code);
            }
            log.info("[CaseProcessor] Wrote test file {} for {}", key, testCase.getId());
        } catch (FileSystemException e) {
            throw new FatalCaseException(testCase.getId(), "Cannot write test file " + testFile + ": " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // VERIFYING
    // =========================================================================

    private void verify(ChecklistStore store, TestCase testCase, AppliedPatch lastApplied)
            throws ChecklistStoreException, PatchLockTimeoutException {

        int attempt = testCase.nextAttemptNumber();

        GateResult gate = qualityGate.check(testCase);
        if (!gate.isPassed()) {
            ExecutionRecord record = ExecutionRecord.gateRejected(testCase.getId(), attempt, gate.getReason());
            appendRecord(store, testCase, record);
            testCase.recordFailure(FailureRecord.undiagnosed(gate.toFailureText(), attempt, false));
            commit(store, testCase, TestCaseStatus.FAILED);
            return;
        }

        SandboxResult result = runSandbox(testCase);
        ExecutionRecord record = ExecutionRecord.sandbox(testCase.getId(), attempt, result.isPassed(),
                result.isTimedOut(), result.getDurationMs(), result.getStdout(), result.getStderr());
        appendRecord(store, testCase, record);

        if (result.isPassed()) {
            log.info("[CaseProcessor] {} passed on attempt {}", testCase.getId(), attempt);
            commit(store, testCase, TestCaseStatus.PASSED);
            return;
        }

        log.info("[CaseProcessor] {} failed on attempt {} (timedOut={})",
                testCase.getId(), attempt, result.isTimedOut());

        Optional<String> conflict = lastApplied != null && rollbackFailedPatches
                ? rollback(testCase, lastApplied)
                : Optional.empty();
        testCase.recordFailure(FailureRecord.undiagnosed(result.failureText(), attempt, result.isTimedOut()));
        commit(store, testCase, TestCaseStatus.FAILED);

        if (conflict.isPresent()) {
            // a failed patch still on disk is never healed over
            escalations.escalate(testCase, EscalationReason.ROLLBACK_CONFLICT, conflict.get());
        }
    }

    private SandboxResult runSandbox(TestCase testCase) {
        try {
            WorkspaceSnapshot snapshot = fileSystem.snapshotWorkspace();
            return sandbox.run(testCase.getSelector(), snapshot, sandbox.defaultTimeout());
        } catch (FileSystemException | SandboxException e) {
            log.warn("[CaseProcessor] Sandbox could not run {}: {}", testCase.getId(), e.getMessage());
            // reported as an environment failure so it is retried under the cap
            return new SandboxResult(false, -2, "", "Sandbox error: " + e.getMessage(), 0L, false);
        }
    }

    /**
     * Undoes a patch whose verification failed.
     *
     * @return why the patch could not be undone, or empty once it has been
     */
    private Optional<String> rollback(TestCase testCase, AppliedPatch applied) throws PatchLockTimeoutException {
        try {
            patchEngine.rollback(applied, testCase);
            return Optional.empty();
        } catch (PatchLockTimeoutException e) {
            throw e;
        } catch (PatchException e) {
            log.warn("[CaseProcessor] Could not roll back {} for {}: {}",
                    applied.getPatchId(), testCase.getId(), e.getMessage());
            return Optional.of("Failed patch " + applied.getPatchId() + " is still in "
                    + applied.getTargetKey() + ": " + e.getMessage());
        }
    }

    // =========================================================================
    // FAILED
    // =========================================================================

    private void diagnose(ChecklistStore store, TestCase testCase) throws ChecklistStoreException {
        FailureRecord failure = testCase.getLastFailure() != null
                ? testCase.getLastFailure()
                : FailureRecord.undiagnosed("", testCase.getExecutionHistory().size(), false);

        Diagnosis diagnosis = classifier.classify(failure.getErrorText(), TestMetadata.of(testCase));
        testCase.recordFailure(failure.withDiagnosis(diagnosis.getCategory(), diagnosis.getScope(),
                diagnosis.getConfidence(), diagnosis.getRecommendedPatchKind(), diagnosis.getTargetFile(),
                diagnosis.getFailingToken(), diagnosis.getSignatureKey(), diagnosis.getExplanation()));

        if (testCase.getRetryCount() >= maxRetries) {
            escalations.escalate(testCase, EscalationReason.RETRIES_EXHAUSTED,
                    "Still failing after " + testCase.getRetryCount() + " healing attempts: " + diagnosis.getCategory());
            return;
        }
        if (!classifier.isConfident(diagnosis)) {
            escalations.escalate(testCase, EscalationReason.LOW_CONFIDENCE, String.format(Locale.ROOT,
                    "%s diagnosed with confidence %.2f (floor %.2f)",
                    diagnosis.getCategory(), diagnosis.getConfidence(), classifier.getConfidenceFloor()));
            return;
        }
        commit(store, testCase, TestCaseStatus.HEALING);
    }

    // =========================================================================
    // HEALING
    // =========================================================================

    /**
     * @return the automated patch applied, or null for a retry without a
     *         patch, a manual fix, or an escalation
     */
    private AppliedPatch heal(ChecklistStore store, TestCase testCase)
            throws ChecklistStoreException, PatchLockTimeoutException {

        if (testCase.isManualFixPending()) {
            applyManualFix(store, testCase);
            return null;
        }

        FailureRecord failure = testCase.getLastFailure();
        if (failure != null && failure.getCategory() == DiagnosisCategory.ENVIRONMENT_ERROR) {
            log.info("[CaseProcessor] {} retrying after environment failure", testCase.getId());
            testCase.incrementRetry();
            commit(store, testCase, TestCaseStatus.VERIFYING);
            return null;
        }

        String target = healingTarget(testCase, failure);
        PatchKind kind = failure != null && failure.getRecommendedPatchKind() != null
                ? failure.getRecommendedPatchKind()
                : PatchKind.FULL_REWRITE;
        String rejection = null;
        boolean drafted  = false;

        for (; kind != null; kind = kind.escalate()) {
            Optional<Patch> draft = collaborator.draftPatch(PatchRequest.builder(testCase.getId(), kind, target)
                    .targetContent(readOrNull(target))
                    .testFile(testCase.getTestFile())
                    .description(testCase.getDescription())
                    .failure(failure)
                    .previousRejection(rejection)
                    .build());

            if (draft.isEmpty()) {
                log.info("[CaseProcessor] No {} draft for {}", kind, testCase.getId());
                continue;
            }
            drafted = true;

            Patch patch = draft.get().getKind() == kind
                    ? draft.get().withOrigin(PatchOrigin.AUTOMATED)
                    : null;
            if (patch == null) {
                rejection = "drafter returned " + draft.get().getKind() + " when " + kind + " was requested";
                continue;
            }

            try {
                AppliedPatch applied = patchEngine.apply(patch, testCase);
                testCase.incrementRetry();
                commit(store, testCase, TestCaseStatus.VERIFYING);
                return applied;
            } catch (PatchLockTimeoutException e) {
                throw e;
            } catch (PatchValidationException e) {
                rejection = e.getResult().getReason();
                log.info("[CaseProcessor] {} patch for {} rejected: {}", kind, testCase.getId(), rejection);
            } catch (PatchException e) {
                rejection = e.getMessage();
                log.warn("[CaseProcessor] {} patch for {} failed to apply: {}", kind, testCase.getId(), rejection);
            }
        }

        if (drafted) {
            escalations.escalate(testCase, EscalationReason.PATCH_VALIDATION_FAILED,
                    "No patch kind up to FULL_REWRITE applied: " + rejection);
        } else {
            escalations.escalate(testCase, EscalationReason.NO_VIABLE_PATCH,
                    "No patch could be drafted for " + target);
        }
        return null;
    }

    private void applyManualFix(ChecklistStore store, TestCase testCase)
            throws ChecklistStoreException, PatchLockTimeoutException {

        Patch manual = testCase.getPendingPatch();
        if (manual == null) {
            log.info("[CaseProcessor] {} re-verifying after manual fix", testCase.getId());
            testCase.clearPendingPatch();
            commit(store, testCase, TestCaseStatus.VERIFYING);
            return;
        }

        try {
            patchEngine.apply(manual, testCase);
            testCase.clearPendingPatch();
            commit(store, testCase, TestCaseStatus.VERIFYING);
        } catch (PatchLockTimeoutException e) {
            throw e;
        } catch (PatchException e) {
            escalations.escalate(testCase, EscalationReason.MANUAL_PATCH_REJECTED, e.getMessage());
        }
    }

    private String healingTarget(TestCase testCase, FailureRecord failure) {
        if (failure != null && failure.getTargetFile() != null) return failure.getTargetFile();
        if (testCase.getTargetFile() != null) return testCase.getTargetFile();
        return testCase.getTestFile();
    }

    private String readOrNull(String file) {
        if (file == null || !fileSystem.fileExists(file)) return null;
        try {
            return fileSystem.readFile(file);
        } catch (FileSystemException e) {
            log.warn("[CaseProcessor] Could not read {}: {}", file, e.getMessage());
            return null;
        }
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    private TestCase load(ChecklistStore store, String caseId) throws FatalCaseException {
        try {
            return store.find(caseId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown test case " + caseId));
        } catch (ChecklistStoreException e) {
            throw new FatalCaseException(caseId, "Checklist store unavailable: " + e.getMessage(), e);
        }
    }

    private void appendRecord(ChecklistStore store, TestCase testCase, ExecutionRecord record)
            throws ChecklistStoreException {
        store.appendExecutionRecord(testCase.getId(), record);
        testCase.appendExecutionRecord(record);
    }

    private void commit(ChecklistStore store, TestCase testCase, TestCaseStatus next)
            throws ChecklistStoreException {
        TestCaseStatus from = testCase.getStatus();
        testCase.transitionTo(next);
        store.save(testCase);
        log.info("[CaseProcessor] {}: {} -> {} (retries {})", testCase.getId(), from, next, testCase.getRetryCount());
        eventBus.publish(new Event(EventType.CASE_TRANSITION, "CaseProcessor", testCase.getRunId(),
                new CaseTransition(from, next, testCase.copy())));
    }
}
