package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one verification attempt, kept with the case for audit.
 * The record id {@code <caseId>#<attempt>} makes re-appending idempotent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionRecord {

    private static final int MAX_OUTPUT_CHARS = 4_000;

    private final String  recordId;
    private final int     attempt;
    private final boolean passed;
    private final boolean timedOut;
    private final long    durationMs;
    private final String  stdout;
    private final String  stderr;

    /** Null when the quality gate passed; otherwise its rejection message. */
    private final String  gateFailure;

    private final Instant recordedAt;

    @JsonCreator
    public ExecutionRecord(
            @JsonProperty("recordId")    String  recordId,
            @JsonProperty("attempt")     int     attempt,
            @JsonProperty("passed")      boolean passed,
            @JsonProperty("timedOut")    boolean timedOut,
            @JsonProperty("durationMs")  long    durationMs,
            @JsonProperty("stdout")      String  stdout,
            @JsonProperty("stderr")      String  stderr,
            @JsonProperty("gateFailure") String  gateFailure,
            @JsonProperty("recordedAt")  Instant recordedAt
    ) {
        this.recordId    = recordId;
        this.attempt     = attempt;
        this.passed      = passed;
        this.timedOut    = timedOut;
        this.durationMs  = durationMs;
        this.stdout      = tail(stdout);
        this.stderr      = tail(stderr);
        this.gateFailure = gateFailure;
        this.recordedAt  = recordedAt;
    }

    public static String recordId(String caseId, int attempt) {
        return caseId + "#" + attempt;
    }

    public static ExecutionRecord sandbox(String caseId, int attempt, boolean passed, boolean timedOut,
                                          long durationMs, String stdout, String stderr) {
        return new ExecutionRecord(recordId(caseId, attempt), attempt, passed, timedOut,
                durationMs, stdout, stderr, null, Instant.now());
    }

    public static ExecutionRecord gateRejected(String caseId, int attempt, String gateFailure) {
        return new ExecutionRecord(recordId(caseId, attempt), attempt, false, false,
                0L, null, null, gateFailure, Instant.now());
    }

    public String  getRecordId()    { return recordId; }
    public int     getAttempt()     { return attempt; }
    public boolean isPassed()       { return passed; }
    public boolean isTimedOut()     { return timedOut; }
    public long    getDurationMs()  { return durationMs; }
    public String  getStdout()      { return stdout; }
    public String  getStderr()      { return stderr; }
    public String  getGateFailure() { return gateFailure; }
    public Instant getRecordedAt()  { return recordedAt; }

    // keep the end of the output, where the failure summary is
    private static String tail(String text) {
        if (text == null || text.length() <= MAX_OUTPUT_CHARS) return text;
        return "[truncated] ..." + text.substring(text.length() - MAX_OUTPUT_CHARS);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{" + recordId + ", passed=" + passed + ", timedOut=" + timedOut + "}";
    }
}
