package com.veriheal.core.knowledge;

public final class PatternStats {

    public static final PatternStats NONE = new PatternStats(0, 0);

    private final int healed;
    private final int escalated;

    public PatternStats(int healed, int escalated) {
        this.healed    = healed;
        this.escalated = escalated;
    }

    PatternStats plus(FailurePattern.Outcome outcome) {
        return outcome == FailurePattern.Outcome.HEALED
                ? new PatternStats(healed + 1, escalated)
                : new PatternStats(healed, escalated + 1);
    }

    public int getHealed()    { return healed; }
    public int getEscalated() { return escalated; }

    public boolean isEmpty() {
        return healed == 0 && escalated == 0;
    }
}
