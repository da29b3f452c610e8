package com.veriheal.core.diagnosis;

import com.veriheal.core.patch.PatchKind;

/**
 * Maps a classified failure to the least invasive patch kind likely to fix
 * it. A pure lookup; no state, no I/O.
 */
public final class PatchKindSelector {

    private PatchKindSelector() { }

    /**
     * A LOCAL failure whose token is not provably unique gets FULL_REWRITE.
     *
     * @param uniqueSignature whether the failing token occurs exactly once in
     *                        the target file
     * @return the kind to try first, or {@code null} when no patch should be
     *         attempted (environment failures)
     */
    public static PatchKind select(DiagnosisCategory category, FailureScope scope, boolean uniqueSignature) {
        if (category == DiagnosisCategory.ENVIRONMENT_ERROR) return null;
        if (scope == FailureScope.LOCAL && uniqueSignature)  return PatchKind.TARGETED_REPLACE;
        if (scope == FailureScope.MULTI_LINE)                return PatchKind.UNIFIED_DIFF;
        return PatchKind.FULL_REWRITE;
    }
}
