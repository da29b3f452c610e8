package com.veriheal.orchestrator;

import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.escalation.EscalationReason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-run report. Every case is counted under exactly one status; cases
 * aborted by a fatal error are listed separately as well.
 */
public final class RunSummary {

    private final String                         runId;
    private final int                            total;
    private final Map<TestCaseStatus, Integer>   statusCounts;
    private final Map<EscalationReason, Integer> escalationReasons;
    private final List<String>                   blocked;
    private final Map<String, String>            fatal;
    private final boolean                        cancelled;
    private final long                           durationMs;

    private RunSummary(String runId, int total, Map<TestCaseStatus, Integer> statusCounts,
                       Map<EscalationReason, Integer> escalationReasons, List<String> blocked,
                       Map<String, String> fatal, boolean cancelled, long durationMs) {
        this.runId             = runId;
        this.total             = total;
        this.statusCounts      = Collections.unmodifiableMap(statusCounts);
        this.escalationReasons = Collections.unmodifiableMap(escalationReasons);
        this.blocked           = Collections.unmodifiableList(blocked);
        this.fatal             = Collections.unmodifiableMap(fatal);
        this.cancelled         = cancelled;
        this.durationMs        = durationMs;
    }

    static RunSummary of(String runId, List<TestCase> cases, Map<String, String> fatal,
                         boolean cancelled, long durationMs) {
        Map<TestCaseStatus, Integer> counts = new EnumMap<>(TestCaseStatus.class);
        for (TestCaseStatus s : TestCaseStatus.values()) counts.put(s, 0);
        Map<EscalationReason, Integer> reasons = new EnumMap<>(EscalationReason.class);
        Map<String, TestCaseStatus> statusById = new LinkedHashMap<>();

        for (TestCase c : cases) {
            counts.merge(c.getStatus(), 1, Integer::sum);
            statusById.put(c.getId(), c.getStatus());
            if (c.getStatus() == TestCaseStatus.ESCALATED && c.getEscalation() != null) {
                reasons.merge(c.getEscalation().getReason(), 1, Integer::sum);
            }
        }

        List<String> blocked = new ArrayList<>();
        for (TestCase c : cases) {
            if (c.getStatus() != TestCaseStatus.PENDING) continue;
            for (String dep : c.getDependsOn()) {
                if (statusById.get(dep) != TestCaseStatus.PASSED) {
                    blocked.add(c.getId());
                    break;
                }
            }
        }

        return new RunSummary(runId, cases.size(), counts, reasons, blocked,
                new LinkedHashMap<>(fatal), cancelled, durationMs);
    }

    public String                         getRunId()             { return runId; }
    public int                            getTotal()             { return total; }
    public Map<TestCaseStatus, Integer>   getStatusCounts()      { return statusCounts; }
    public Map<EscalationReason, Integer> getEscalationReasons() { return escalationReasons; }
    public List<String>                   getBlocked()           { return blocked; }
    public Map<String, String>            getFatal()             { return fatal; }
    public boolean                        isCancelled()          { return cancelled; }
    public long                           getDurationMs()        { return durationMs; }

    public int count(TestCaseStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }

    /**
     * Cases whose tests pass. FLAGGED_BUG, SKIPPED and EXPECTED_FAILURE are
     * not passing tests.
     */
    public int getPassing() {
        return count(TestCaseStatus.PASSED);
    }

    /**
     * Cases that still need work: not final and not escalated.
     */
    public int getUnfinished() {
        int n = 0;
        for (Map.Entry<TestCaseStatus, Integer> e : statusCounts.entrySet()) {
            if (!e.getKey().isTerminalForScheduling()) n += e.getValue();
        }
        return n;
    }

    /**
     * Process exit code: non-zero only in strict mode when some case ended
     * FAILED or ESCALATED, or was aborted.
     */
    public int exitCode(boolean strict) {
        if (!strict) return 0;
        boolean bad = count(TestCaseStatus.FAILED) > 0 || count(TestCaseStatus.ESCALATED) > 0 || !fatal.isEmpty();
        return bad ? 1 : 0;
    }

    @Override
    public String toString() {
        return String.format("RunSummary{%s: total=%d, passed=%d, escalated=%d, flaggedBug=%d, skipped=%d, "
                        + "expectedFailure=%d, blocked=%d, fatal=%d%s}",
                runId, total, getPassing(), count(TestCaseStatus.ESCALATED), count(TestCaseStatus.FLAGGED_BUG),
                count(TestCaseStatus.SKIPPED), count(TestCaseStatus.EXPECTED_FAILURE), blocked.size(), fatal.size(),
                cancelled ? ", cancelled" : "");
    }
}
