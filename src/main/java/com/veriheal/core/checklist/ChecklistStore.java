package com.veriheal.core.checklist;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of the test cases of one run.
 *
 * All operations are idempotent; a crash during any of them leaves each case
 * record either at its old or at its new value.
 */
public interface ChecklistStore {

    String runId();

    /**
     * Working copies of every case, ordered by insertion sequence.
     */
    List<TestCase> load() throws ChecklistStoreException;

    Optional<TestCase> find(String caseId) throws ChecklistStoreException;

    /**
     * Replaces the stored record of {@code testCase}. A stored PASSED case can
     * only be re-saved as PASSED.
     *
     * @throws IllegalArgumentException if the case is unknown to this run
     */
    void save(TestCase testCase) throws ChecklistStoreException;

    /**
     * Appends to the case's execution history; a record whose id is already
     * present is ignored.
     */
    void appendExecutionRecord(String caseId, ExecutionRecord record) throws ChecklistStoreException;
}
