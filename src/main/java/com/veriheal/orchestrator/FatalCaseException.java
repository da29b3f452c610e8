package com.veriheal.orchestrator;

/**
 * Processing of one case cannot continue: the checklist could not be
 * written, or a file lock was not obtained in time. The case keeps its last
 * committed status; the rest of the run carries on.
 */
public class FatalCaseException extends Exception {

    private final String caseId;

    public FatalCaseException(String caseId, String message, Throwable cause) {
        super(message, cause);
        this.caseId = caseId;
    }

    public String getCaseId() {
        return caseId;
    }
}
