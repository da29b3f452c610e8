package com.veriheal.core.diagnosis;

/**
 * Deterministic facts pulled out of raw test output before any
 * classification: the error type, the deepest project frame and the name the
 * error is about.
 */
public final class FailureSignature {

    private final String errorType;      // e.g. "ModuleNotFoundError", "java.lang.AssertionError"
    private final String message;        // first line of the error message
    private final String failingFile;    // workspace-relative when it could be made so
    private final int    failingLine;    // -1 if unknown
    private final String failingToken;   // missing name / symbol / module, if any
    private final String signatureKey;

    public FailureSignature(String errorType, String message, String failingFile,
                            int failingLine, String failingToken, String signatureKey) {
        this.errorType    = errorType;
        this.message      = message;
        this.failingFile  = failingFile;
        this.failingLine  = failingLine;
        this.failingToken = failingToken;
        this.signatureKey = signatureKey;
    }

    public static FailureSignature empty() {
        return new FailureSignature(null, null, null, -1, null, "EMPTY");
    }

    public String getErrorType()    { return errorType; }
    public String getMessage()      { return message; }
    public String getFailingFile()  { return failingFile; }
    public int    getFailingLine()  { return failingLine; }
    public String getFailingToken() { return failingToken; }
    public String getSignatureKey() { return signatureKey; }

    @Override
    public String toString() {
        return String.format("FailureSignature{type=%s, file=%s, line=%d, token=%s}",
                errorType, failingFile, failingLine, failingToken);
    }
}
