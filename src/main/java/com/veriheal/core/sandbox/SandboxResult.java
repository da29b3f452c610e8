package com.veriheal.core.sandbox;

public class SandboxResult {

    private final boolean passed;
    private final int     exitCode;
    private final String  stdout;
    private final String  stderr;
    private final long    durationMs;
    private final boolean timedOut;

    public SandboxResult(boolean passed, int exitCode, String stdout, String stderr,
                         long durationMs, boolean timedOut) {
        this.passed     = passed;
        this.exitCode   = exitCode;
        this.stdout     = stdout != null ? stdout : "";
        this.stderr     = stderr != null ? stderr : "";
        this.durationMs = durationMs;
        this.timedOut   = timedOut;
    }

    public static SandboxResult passed(String stdout, long durationMs) {
        return new SandboxResult(true, 0, stdout, "", durationMs, false);
    }

    public static SandboxResult failed(int exitCode, String stdout, String stderr, long durationMs) {
        return new SandboxResult(false, exitCode, stdout, stderr, durationMs, false);
    }

    public static SandboxResult timedOut(String partialOutput, long timeoutSeconds, long durationMs) {
        return new SandboxResult(false, -1, partialOutput,
                "TIMEOUT after " + timeoutSeconds + " seconds", durationMs, true);
    }

    public boolean isPassed()      { return passed; }
    public int     getExitCode()   { return exitCode; }
    public String  getStdout()     { return stdout; }
    public String  getStderr()     { return stderr; }
    public long    getDurationMs() { return durationMs; }
    public boolean isTimedOut()    { return timedOut; }

    /**
     * Text handed to the classifier: stderr first, since that is where the
     * timeout marker and runner errors end up.
     */
    public String failureText() {
        if (stderr.isBlank()) return stdout;
        if (stdout.isBlank()) return stderr;
        return stderr + "\n" + stdout;
    }

    @Override
    public String toString() {
        return "SandboxResult{passed=" + passed + ", exitCode=" + exitCode
                + ", timedOut=" + timedOut + ", durationMs=" + durationMs + "}";
    }
}
