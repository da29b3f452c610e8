package com.veriheal.core.patch;

public enum PatchOrigin {
    /** Drafted by the healing collaborator. */
    AUTOMATED,
    /** Supplied by a human with a "fix" verdict. */
    MANUAL
}
