package com.veriheal.core.patch;

public final class ValidationResult {

    private final boolean valid;
    private final PatchKind kind;
    private final String reason;

    /** Occurrences of the old text for TARGETED_REPLACE, -1 for other kinds. */
    private final int occurrences;

    private ValidationResult(boolean valid, PatchKind kind, String reason, int occurrences) {
        this.valid       = valid;
        this.kind        = kind;
        this.reason      = reason;
        this.occurrences = occurrences;
    }

    public static ValidationResult ok(PatchKind kind) {
        return new ValidationResult(true, kind, "ok", -1);
    }

    public static ValidationResult ok(PatchKind kind, int occurrences) {
        return new ValidationResult(true, kind, "ok", occurrences);
    }

    public static ValidationResult rejected(PatchKind kind, String reason) {
        return new ValidationResult(false, kind, reason, -1);
    }

    public static ValidationResult rejected(PatchKind kind, String reason, int occurrences) {
        return new ValidationResult(false, kind, reason, occurrences);
    }

    public boolean   isValid()        { return valid; }
    public PatchKind getKind()        { return kind; }
    public String    getReason()      { return reason; }
    public int       getOccurrences() { return occurrences; }

    @Override
    public String toString() {
        return "ValidationResult{" + kind + ", valid=" + valid + ", reason=" + reason + "}";
    }
}
