package com.veriheal.core.event;

public enum EventType {
    RUN_STARTED,
    RUN_FINISHED,
    CASE_TRANSITION,
    CASE_ESCALATED,
    CASE_RESOLVED,
    PATCH_APPLIED,
    PATCH_ROLLED_BACK
}
