package com.veriheal.core.escalation;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Human decision on an escalated case.
 */
public enum Verdict {
    FIX,
    FLAG_BUG,
    SKIP,
    KEEP_AS_EXPECTED_FAILURE;

    /**
     * Accepts both {@code FLAG_BUG} and {@code flag_bug}.
     */
    @JsonCreator
    public static Verdict parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Verdict is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown verdict: " + value);
        }
    }
}
