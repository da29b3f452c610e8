package com.veriheal.core.patch;

/**
 * Structural patch kinds, ordered from least to most invasive.
 */
public enum PatchKind {
    TARGETED_REPLACE,
    UNIFIED_DIFF,
    FULL_REWRITE;

    /**
     * Next more invasive kind, or {@code null} after FULL_REWRITE.
     */
    public PatchKind escalate() {
        return switch (this) {
            case TARGETED_REPLACE -> UNIFIED_DIFF;
            case UNIFIED_DIFF     -> FULL_REWRITE;
            case FULL_REWRITE     -> null;
        };
    }
}
