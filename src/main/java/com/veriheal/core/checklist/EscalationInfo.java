package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.veriheal.core.escalation.EscalationReason;
import com.veriheal.core.escalation.Verdict;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EscalationInfo {

    private final EscalationReason reason;
    private final String           detail;
    private final Instant          escalatedAt;
    private final Verdict          verdict;
    private final Instant          resolvedAt;
    private final String           note;

    @JsonCreator
    public EscalationInfo(
            @JsonProperty("reason")      EscalationReason reason,
            @JsonProperty("detail")      String           detail,
            @JsonProperty("escalatedAt") Instant          escalatedAt,
            @JsonProperty("verdict")     Verdict          verdict,
            @JsonProperty("resolvedAt")  Instant          resolvedAt,
            @JsonProperty("note")        String           note
    ) {
        this.reason      = reason;
        this.detail      = detail;
        this.escalatedAt = escalatedAt;
        this.verdict     = verdict;
        this.resolvedAt  = resolvedAt;
        this.note        = note;
    }

    public static EscalationInfo open(EscalationReason reason, String detail) {
        return new EscalationInfo(reason, detail, Instant.now(), null, null, null);
    }

    public EscalationInfo resolved(Verdict verdict, String note) {
        return new EscalationInfo(reason, detail, escalatedAt, verdict, Instant.now(), note);
    }

    public boolean isResolved() {
        return verdict != null;
    }

    public EscalationReason getReason()      { return reason; }
    public String           getDetail()      { return detail; }
    public Instant          getEscalatedAt() { return escalatedAt; }
    public Verdict          getVerdict()     { return verdict; }
    public Instant          getResolvedAt()  { return resolvedAt; }
    public String           getNote()        { return note; }
}
