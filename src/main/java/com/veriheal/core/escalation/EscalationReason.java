package com.veriheal.core.escalation;

public enum EscalationReason {
    RETRIES_EXHAUSTED,
    LOW_CONFIDENCE,
    NO_VIABLE_PATCH,
    PATCH_VALIDATION_FAILED,
    MANUAL_PATCH_REJECTED,
    ROLLBACK_CONFLICT
}
