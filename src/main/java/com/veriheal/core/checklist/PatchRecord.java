package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.veriheal.core.patch.PatchKind;
import com.veriheal.core.patch.PatchOrigin;

import java.time.Instant;

/**
 * Persisted trace of a patch applied on behalf of a case. The pre-apply
 * snapshot itself is not persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PatchRecord {

    private final String      patchId;
    private final PatchKind   kind;
    private final String      targetFile;
    private final double      confidence;
    private final PatchOrigin origin;
    private final Instant     appliedAt;
    private final Instant     rolledBackAt;

    @JsonCreator
    public PatchRecord(
            @JsonProperty("patchId")      String      patchId,
            @JsonProperty("kind")         PatchKind   kind,
            @JsonProperty("targetFile")   String      targetFile,
            @JsonProperty("confidence")   double      confidence,
            @JsonProperty("origin")       PatchOrigin origin,
            @JsonProperty("appliedAt")    Instant     appliedAt,
            @JsonProperty("rolledBackAt") Instant     rolledBackAt
    ) {
        this.patchId      = patchId;
        this.kind         = kind;
        this.targetFile   = targetFile;
        this.confidence   = confidence;
        this.origin       = origin;
        this.appliedAt    = appliedAt;
        this.rolledBackAt = rolledBackAt;
    }

    public PatchRecord withRolledBackAt(Instant at) {
        return new PatchRecord(patchId, kind, targetFile, confidence, origin, appliedAt, at);
    }

    public String      getPatchId()      { return patchId; }
    public PatchKind   getKind()         { return kind; }
    public String      getTargetFile()   { return targetFile; }
    public double      getConfidence()   { return confidence; }
    public PatchOrigin getOrigin()       { return origin; }
    public Instant     getAppliedAt()    { return appliedAt; }
    public Instant     getRolledBackAt() { return rolledBackAt; }

    public boolean isRolledBack() {
        return rolledBackAt != null;
    }

    @Override
    public String toString() {
        return "PatchRecord{" + patchId + ", " + kind + " on " + targetFile
                + (isRolledBack() ? ", rolledBack" : "") + "}";
    }
}
