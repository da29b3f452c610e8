package com.veriheal.core.escalation;

import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.checklist.TestCase;

import java.time.Instant;
import java.util.List;

/**
 * What a reviewer needs to decide on an escalated case.
 */
public final class EscalationTicket {

    private final String           runId;
    private final String           caseId;
    private final EscalationReason reason;
    private final String           detail;
    private final Instant          escalatedAt;
    private final int              retryCount;
    private final List<String>     patchesApplied;
    private final FailureRecord    lastFailure;

    public EscalationTicket(String runId, String caseId, EscalationReason reason, String detail,
                            Instant escalatedAt, int retryCount, List<String> patchesApplied,
                            FailureRecord lastFailure) {
        this.runId          = runId;
        this.caseId         = caseId;
        this.reason         = reason;
        this.detail         = detail;
        this.escalatedAt    = escalatedAt;
        this.retryCount     = retryCount;
        this.patchesApplied = List.copyOf(patchesApplied);
        this.lastFailure    = lastFailure;
    }

    static EscalationTicket of(TestCase c) {
        return new EscalationTicket(c.getRunId(), c.getId(),
                c.getEscalation().getReason(), c.getEscalation().getDetail(),
                c.getEscalation().getEscalatedAt(), c.getRetryCount(),
                c.getPatchesApplied(), c.getLastFailure());
    }

    public String           getRunId()          { return runId; }
    public String           getCaseId()         { return caseId; }
    public EscalationReason getReason()         { return reason; }
    public String           getDetail()         { return detail; }
    public Instant          getEscalatedAt()    { return escalatedAt; }
    public int              getRetryCount()     { return retryCount; }
    public List<String>     getPatchesApplied() { return patchesApplied; }
    public FailureRecord    getLastFailure()    { return lastFailure; }

    @Override
    public String toString() {
        return "EscalationTicket{" + runId + "/" + caseId + ", reason=" + reason + "}";
    }
}
