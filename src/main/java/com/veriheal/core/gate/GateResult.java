package com.veriheal.core.gate;

public final class GateResult {

    private static final GateResult PASSED = new GateResult(true, "All checks passed.");

    private final boolean passed;
    private final String  reason;

    private GateResult(boolean passed, String reason) {
        this.passed = passed;
        this.reason = reason;
    }

    public static GateResult passed() {
        return PASSED;
    }

    public static GateResult failed(String reason) {
        return new GateResult(false, reason);
    }

    public boolean isPassed() { return passed; }
    public String  getReason() { return reason; }

    /** Failure text recorded on the case when the gate rejects it. */
    public String toFailureText() {
        return QualityGate.FAILURE_PREFIX + reason;
    }

    @Override
    public String toString() {
        return "GateResult{passed=" + passed + ", reason=" + reason + "}";
    }
}
