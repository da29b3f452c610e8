package com.veriheal.core.diagnosis;

/**
 * How much of the target file a fix is expected to touch.
 */
public enum FailureScope {
    /** A single line or token. */
    LOCAL,
    /** A contiguous block of lines, e.g. a fixture or a function body. */
    MULTI_LINE,
    /** Structure of the whole file. */
    FILE_WIDE
}
