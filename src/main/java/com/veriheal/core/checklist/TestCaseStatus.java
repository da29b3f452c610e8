package com.veriheal.core.checklist;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a test case.
 *
 * <pre>
 * PENDING -> GENERATING -> VERIFYING -> PASSED
 *                              |
 *                           FAILED -> HEALING -> VERIFYING
 *                              |        |
 *                              +--> ESCALATED -> HEALING | FLAGGED_BUG | SKIPPED | EXPECTED_FAILURE
 * </pre>
 */
public enum TestCaseStatus {
    PENDING,
    GENERATING,
    VERIFYING,
    PASSED,
    FAILED,
    HEALING,
    ESCALATED,
    SKIPPED,
    FLAGGED_BUG,
    EXPECTED_FAILURE;

    private static final Set<TestCaseStatus> FINAL =
            EnumSet.of(PASSED, SKIPPED, FLAGGED_BUG, EXPECTED_FAILURE);

    /**
     * No automated step will ever move a case out of a final status.
     */
    public boolean isFinal() {
        return FINAL.contains(this);
    }

    /**
     * Final statuses plus ESCALATED, which only a human verdict can reopen.
     */
    public boolean isTerminalForScheduling() {
        return isFinal() || this == ESCALATED;
    }

    /**
     * Statuses reachable from this one by a single transition.
     */
    public Set<TestCaseStatus> successors() {
        return switch (this) {
            case PENDING    -> EnumSet.of(GENERATING);
            case GENERATING -> EnumSet.of(VERIFYING);
            case VERIFYING  -> EnumSet.of(PASSED, FAILED);
            case FAILED     -> EnumSet.of(HEALING, ESCALATED);
            case HEALING    -> EnumSet.of(VERIFYING, ESCALATED);
            case ESCALATED  -> EnumSet.of(HEALING, FLAGGED_BUG, SKIPPED, EXPECTED_FAILURE);
            default         -> EnumSet.noneOf(TestCaseStatus.class);
        };
    }

    public boolean canMoveTo(TestCaseStatus next) {
        return successors().contains(next);
    }
}
