package com.veriheal.core.knowledge;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.patch.PatchKind;

import java.time.Instant;

/**
 * One learned outcome: how a failure with a given signature ended.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FailurePattern {

    public enum Outcome { HEALED, ESCALATED }

    private final String            signatureKey;
    private final DiagnosisCategory category;
    private final PatchKind         patchKind;
    private final Outcome           outcome;
    private final String            runId;
    private final String            caseId;
    private final Instant           recordedAt;

    @JsonCreator
    public FailurePattern(
            @JsonProperty("signatureKey") String            signatureKey,
            @JsonProperty("category")     DiagnosisCategory category,
            @JsonProperty("patchKind")    PatchKind         patchKind,
            @JsonProperty("outcome")      Outcome           outcome,
            @JsonProperty("runId")        String            runId,
            @JsonProperty("caseId")       String            caseId,
            @JsonProperty("recordedAt")   Instant           recordedAt
    ) {
        this.signatureKey = signatureKey;
        this.category     = category;
        this.patchKind    = patchKind;
        this.outcome      = outcome;
        this.runId        = runId;
        this.caseId       = caseId;
        this.recordedAt   = recordedAt;
    }

    public String            getSignatureKey() { return signatureKey; }
    public DiagnosisCategory getCategory()     { return category; }
    public PatchKind         getPatchKind()    { return patchKind; }
    public Outcome           getOutcome()      { return outcome; }
    public String            getRunId()        { return runId; }
    public String            getCaseId()       { return caseId; }
    public Instant           getRecordedAt()   { return recordedAt; }
}
