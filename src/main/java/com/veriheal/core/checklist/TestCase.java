package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.veriheal.core.patch.Patch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the checklist.
 *
 * The store owns the canonical copy. Workers operate on a {@link #copy()} for
 * a single transition and save it back; they never share an instance.
 *
 * Once PASSED the case is locked: every mutator throws.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(
        fieldVisibility    = JsonAutoDetect.Visibility.ANY,
        getterVisibility   = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility   = JsonAutoDetect.Visibility.NONE)
public class TestCase {

    // ---- definition, supplied upstream
    private String       id;
    private int          priority;
    private List<String> dependsOn = new ArrayList<>();
    private String       selector;
    private String       testFile;
    private String       targetFile;
    private String       description;
    private String       testCode;
    private Double       generationConfidence;

    // ---- runtime state
    private String         runId;
    private int            sequence;
    private TestCaseStatus status = TestCaseStatus.PENDING;
    private int            retryCount;
    private FailureRecord  lastFailure;
    private EscalationInfo escalation;
    private Patch          pendingPatch;
    private boolean        manualFixPending;

    private List<String>          patchesApplied   = new ArrayList<>();
    private List<PatchRecord>     patchHistory     = new ArrayList<>();
    private List<ExecutionRecord> executionHistory = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    protected TestCase() {
        // Jackson
    }

    private TestCase(Builder b) {
        if (b.id == null || b.id.isBlank()) throw new IllegalArgumentException("Test case id is required");
        this.id                   = b.id;
        this.priority             = b.priority;
        this.dependsOn            = new ArrayList<>(b.dependsOn);
        this.selector             = b.selector != null ? b.selector : b.testFile;
        this.testFile             = b.testFile;
        this.targetFile           = b.targetFile;
        this.description          = b.description;
        this.testCode             = b.testCode;
        this.generationConfidence = b.generationConfidence;
    }

    // ================================================================
    // Transitions
    // ================================================================

    public void transitionTo(TestCaseStatus next) {
        ensureNotLocked();
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException(String.format(
                    "Illegal transition for %s: %s -> %s", id, status, next));
        }
        this.status = next;
        touch();
    }

    public void incrementRetry() {
        ensureNotLocked();
        this.retryCount++;
        touch();
    }

    public void recordFailure(FailureRecord failure) {
        ensureNotLocked();
        this.lastFailure = failure;
        touch();
    }

    public void recordGeneratedTest(String code, Double confidence) {
        ensureNotLocked();
        this.testCode             = code;
        this.generationConfidence = confidence;
        touch();
    }

    /**
     * Appends the patch to the audit trail. Ids are never removed, even when
     * the patch is later rolled back.
     */
    public void appendPatch(PatchRecord record) {
        ensureNotLocked();
        if (!patchesApplied.contains(record.getPatchId())) {
            patchesApplied.add(record.getPatchId());
            patchHistory.add(record);
        }
        touch();
    }

    public void markPatchRolledBack(String patchId, Instant at) {
        ensureNotLocked();
        for (int i = 0; i < patchHistory.size(); i++) {
            PatchRecord record = patchHistory.get(i);
            if (record.getPatchId().equals(patchId) && !record.isRolledBack()) {
                patchHistory.set(i, record.withRolledBackAt(at));
            }
        }
        touch();
    }

    /**
     * @return false if a record with the same id is already present
     */
    public boolean appendExecutionRecord(ExecutionRecord record) {
        for (ExecutionRecord existing : executionHistory) {
            if (existing.getRecordId().equals(record.getRecordId())) return false;
        }
        executionHistory.add(record);
        touch();
        return true;
    }

    public void setEscalation(EscalationInfo info) {
        ensureNotLocked();
        this.escalation = info;
        touch();
    }

    public void setPendingPatch(Patch patch, boolean manualFix) {
        ensureNotLocked();
        this.pendingPatch     = patch;
        this.manualFixPending = manualFix;
        touch();
    }

    public void clearPendingPatch() {
        ensureNotLocked();
        this.pendingPatch     = null;
        this.manualFixPending = false;
        touch();
    }

    /** Used by the store when a batch is first persisted. */
    void initialise(String runId, int sequence, Instant now) {
        this.runId     = runId;
        this.sequence  = sequence;
        this.status    = TestCaseStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    private void ensureNotLocked() {
        if (status == TestCaseStatus.PASSED) {
            throw new IllegalStateException("Test case " + id + " is PASSED and locked");
        }
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    // ================================================================
    // Copy
    // ================================================================

    /**
     * Deep copy. Nested records are immutable, so copying the lists suffices.
     */
    public TestCase copy() {
        TestCase c = new TestCase();
        c.id                   = id;
        c.priority             = priority;
        c.dependsOn            = new ArrayList<>(dependsOn);
        c.selector             = selector;
        c.testFile             = testFile;
        c.targetFile           = targetFile;
        c.description          = description;
        c.testCode             = testCode;
        c.generationConfidence = generationConfidence;
        c.runId                = runId;
        c.sequence             = sequence;
        c.status               = status;
        c.retryCount           = retryCount;
        c.lastFailure          = lastFailure;
        c.escalation           = escalation;
        c.pendingPatch         = pendingPatch;
        c.manualFixPending     = manualFixPending;
        c.patchesApplied       = new ArrayList<>(patchesApplied);
        c.patchHistory         = new ArrayList<>(patchHistory);
        c.executionHistory     = new ArrayList<>(executionHistory);
        c.createdAt            = createdAt;
        c.updatedAt            = updatedAt;
        return c;
    }

    /**
     * Copy of the upstream definition only, with all runtime state reset.
     */
    public TestCase definitionCopy() {
        return builder(id)
                .priority(priority)
                .dependsOn(dependsOn)
                .selector(selector)
                .testFile(testFile)
                .targetFile(targetFile)
                .description(description)
                .testCode(testCode)
                .generationConfidence(generationConfidence)
                .build();
    }

    // ================================================================
    // Accessors
    // ================================================================

    public String         getId()                   { return id; }
    public int            getPriority()             { return priority; }
    public List<String>   getDependsOn()            { return Collections.unmodifiableList(dependsOn); }
    public String         getSelector()             { return selector; }
    public String         getTestFile()             { return testFile; }
    public String         getTargetFile()           { return targetFile; }
    public String         getDescription()          { return description; }
    public String         getTestCode()             { return testCode; }
    public Double         getGenerationConfidence() { return generationConfidence; }
    public String         getRunId()                { return runId; }
    public int            getSequence()             { return sequence; }
    public TestCaseStatus getStatus()               { return status; }
    public int            getRetryCount()           { return retryCount; }
    public FailureRecord  getLastFailure()          { return lastFailure; }
    public EscalationInfo getEscalation()           { return escalation; }
    public Patch          getPendingPatch()         { return pendingPatch; }
    public boolean        isManualFixPending()      { return manualFixPending; }
    public Instant        getCreatedAt()            { return createdAt; }
    public Instant        getUpdatedAt()            { return updatedAt; }

    public List<String>          getPatchesApplied()   { return Collections.unmodifiableList(patchesApplied); }
    public List<PatchRecord>     getPatchHistory()     { return Collections.unmodifiableList(patchHistory); }
    public List<ExecutionRecord> getExecutionHistory() { return Collections.unmodifiableList(executionHistory); }

    public int nextAttemptNumber() {
        return executionHistory.size() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestCase)) return false;
        TestCase other = (TestCase) o;
        return Objects.equals(runId, other.runId) && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, id);
    }

    @Override
    public String toString() {
        return "TestCase{" + id + ", status=" + status + ", retries=" + retryCount
                + ", patches=" + patchesApplied.size() + "}";
    }

    // ================================================================
    // Builder
    // ================================================================

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private int          priority             = 0;
        private List<String> dependsOn            = new ArrayList<>();
        private String       selector             = null;
        private String       testFile             = null;
        private String       targetFile           = null;
        private String       description          = null;
        private String       testCode             = null;
        private Double       generationConfidence = null;

        private Builder(String id) {
            this.id = id;
        }

        public Builder priority(int v)                { this.priority = v;                         return this; }
        public Builder dependsOn(List<String> v)      { this.dependsOn = new ArrayList<>(v);        return this; }
        public Builder dependsOn(String... v)         { this.dependsOn = new ArrayList<>(List.of(v)); return this; }
        public Builder selector(String v)             { this.selector = v;                         return this; }
        public Builder testFile(String v)             { this.testFile = v;                         return this; }
        public Builder targetFile(String v)           { this.targetFile = v;                       return this; }
        public Builder description(String v)          { this.description = v;                      return this; }
        public Builder testCode(String v)             { this.testCode = v;                         return this; }
        public Builder generationConfidence(Double v) { this.generationConfidence = v;             return this; }

        public TestCase build() { return new TestCase(this); }
    }
}
