package com.veriheal.orchestrator;

import com.veriheal.core.checklist.TestCaseStatus;

/**
 * How a worker left a case: at a terminal status, stopped by cancellation, or
 * aborted by a fatal error.
 */
final class CaseOutcome {

    private final String         caseId;
    private final TestCaseStatus status;
    private final boolean        cancelled;
    private final String         fatalError;

    private CaseOutcome(String caseId, TestCaseStatus status, boolean cancelled, String fatalError) {
        this.caseId     = caseId;
        this.status     = status;
        this.cancelled  = cancelled;
        this.fatalError = fatalError;
    }

    static CaseOutcome finished(String caseId, TestCaseStatus status) {
        return new CaseOutcome(caseId, status, false, null);
    }

    static CaseOutcome cancelled(String caseId, TestCaseStatus status) {
        return new CaseOutcome(caseId, status, true, null);
    }

    static CaseOutcome fatal(String caseId, String error) {
        return new CaseOutcome(caseId, null, false, error);
    }

    String         getCaseId()     { return caseId; }
    TestCaseStatus getStatus()     { return status; }
    boolean        isCancelled()   { return cancelled; }
    boolean        isFatal()       { return fatalError != null; }
    String         getFatalError() { return fatalError; }

    @Override
    public String toString() {
        return "CaseOutcome{" + caseId + ", status=" + status
                + (cancelled ? ", cancelled" : "") + (isFatal() ? ", fatal=" + fatalError : "") + "}";
    }
}
