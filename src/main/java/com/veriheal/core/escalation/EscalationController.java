package com.veriheal.core.escalation;

import com.veriheal.communication.EventBus;
import com.veriheal.core.checklist.ChecklistStore;
import com.veriheal.core.checklist.ChecklistStoreException;
import com.veriheal.core.checklist.ChecklistStoreFactory;
import com.veriheal.core.checklist.EscalationInfo;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parks cases that automated healing cannot finish and applies human
 * verdicts to them. Nothing here resolves a case on its own; an escalated
 * case waits until {@link #resolve} is called for it, and only that case
 * waits.
 */
@Component
public class EscalationController {

    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    private final ChecklistStoreFactory stores;
    private final EventBus              eventBus;

    public EscalationController(ChecklistStoreFactory stores, EventBus eventBus) {
        this.stores   = stores;
        this.eventBus = eventBus;
    }

    /**
     * Moves {@code testCase} to ESCALATED and commits it.
     *
     * @param testCase working copy in FAILED or HEALING; updated in place
     */
    public EscalationTicket escalate(TestCase testCase, EscalationReason reason, String detail)
            throws ChecklistStoreException {
        ChecklistStore store = stores.open(testCase.getRunId());

        testCase.transitionTo(TestCaseStatus.ESCALATED);
        testCase.setEscalation(EscalationInfo.open(reason, detail));
        testCase.clearPendingPatch();
        store.save(testCase);

        EscalationTicket ticket = EscalationTicket.of(testCase);
        log.warn("[Escalation] {} escalated: {} ({})", testCase.getId(), reason, detail);
        eventBus.publish(new Event(EventType.CASE_ESCALATED, "EscalationController", testCase.getRunId(), ticket));
        return ticket;
    }

    /**
     * Open tickets of a run, in checklist order.
     */
    public List<EscalationTicket> pending(String runId) throws ChecklistStoreException {
        List<EscalationTicket> tickets = new ArrayList<>();
        for (TestCase c : stores.open(runId).load()) {
            if (c.getStatus() == TestCaseStatus.ESCALATED && c.getEscalation() != null) {
                tickets.add(EscalationTicket.of(c));
            }
        }
        return tickets;
    }

    /**
     * Applies a human verdict.
     *
     * FIX reopens the case in HEALING; the optional {@code manualPatch} is
     * applied by the next healing step without consuming a retry. Without a
     * patch the (human-edited) tree is re-verified. The other verdicts are
     * final.
     *
     * @throws IllegalArgumentException if the case does not exist
     * @throws IllegalStateException if the case is not ESCALATED
     */
    public TestCase resolve(String runId, String caseId, Verdict verdict, Patch manualPatch, String note)
            throws ChecklistStoreException {
        ChecklistStore store = stores.open(runId);
        TestCase testCase = store.find(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test case " + caseId + " in run " + runId));

        if (testCase.getStatus() != TestCaseStatus.ESCALATED) {
            throw new IllegalStateException("Test case " + caseId + " is " + testCase.getStatus() + ", not ESCALATED");
        }
        if (manualPatch != null && verdict != Verdict.FIX) {
            throw new IllegalArgumentException("A manual patch is only accepted with verdict FIX");
        }

        switch (verdict) {
            case FIX:
                testCase.transitionTo(TestCaseStatus.HEALING);
                testCase.setPendingPatch(manualPatch != null ? manualPatch.withOrigin(PatchOrigin.MANUAL) : null, true);
                break;
            case FLAG_BUG:
                testCase.transitionTo(TestCaseStatus.FLAGGED_BUG);
                break;
            case SKIP:
                testCase.transitionTo(TestCaseStatus.SKIPPED);
                break;
            case KEEP_AS_EXPECTED_FAILURE:
                testCase.transitionTo(TestCaseStatus.EXPECTED_FAILURE);
                break;
        }

        EscalationInfo info = testCase.getEscalation() != null
                ? testCase.getEscalation()
                : EscalationInfo.open(EscalationReason.RETRIES_EXHAUSTED, "unknown");
        testCase.setEscalation(info.resolved(verdict, note));
        store.save(testCase);

        log.info("[Escalation] {} resolved with {} -> {}", caseId, verdict, testCase.getStatus());
        eventBus.publish(new Event(EventType.CASE_RESOLVED, "EscalationController", runId, testCase.copy()));
        return testCase;
    }
}
