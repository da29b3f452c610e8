package com.veriheal.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for run and case correlation in log output.
 */
public final class MdcContext {

    public static final String RUN_ID  = "runId";
    public static final String CASE_ID = "caseId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setCase(String runId, String caseId) {
        MDC.put(RUN_ID, runId);
        MDC.put(CASE_ID, caseId);
    }

    public static void clearCase() {
        MDC.remove(CASE_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(CASE_ID);
    }
}
