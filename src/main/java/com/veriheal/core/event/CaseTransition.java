package com.veriheal.core.event;

import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;

/**
 * Payload of {@link EventType#CASE_TRANSITION}: a committed status change,
 * with a copy of the case as committed.
 */
public final class CaseTransition {

    private final TestCaseStatus from;
    private final TestCaseStatus to;
    private final TestCase       snapshot;

    public CaseTransition(TestCaseStatus from, TestCaseStatus to, TestCase snapshot) {
        this.from     = from;
        this.to       = to;
        this.snapshot = snapshot;
    }

    public TestCaseStatus getFrom()     { return from; }
    public TestCaseStatus getTo()       { return to; }
    public TestCase       getSnapshot() { return snapshot; }
    public String         getCaseId()   { return snapshot.getId(); }

    @Override
    public String toString() {
        return snapshot.getId() + ": " + from + " -> " + to;
    }
}
