package com.veriheal.core.checklist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Creates and reopens per-run checklist stores under the checklist directory.
 * Hands out a single store instance per run id so all writers of a run share
 * its serialisation.
 */
@Component
public class ChecklistStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(ChecklistStoreFactory.class);

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private final Path checklistDir;
    private final Map<String, JsonChecklistStore> stores = new ConcurrentHashMap<>();

    public ChecklistStoreFactory(
            @Value("${veriheal.checklist.dir}") String checklistDir
    ) {
        this.checklistDir = Paths.get(checklistDir).toAbsolutePath().normalize();
        log.info("[Checklist] Checklist directory: {}", this.checklistDir);
    }

    /**
     * Validates and persists a new batch.
     *
     * @throws IllegalArgumentException on an invalid run id, an empty batch,
     *         duplicate case ids, or a dependency on an id outside the batch
     */
    public synchronized ChecklistStore create(String runId, List<TestCase> batch)
            throws ChecklistStoreException {
        validateRunId(runId);
        validateBatch(batch);
        if (stores.containsKey(runId)) {
            throw new IllegalArgumentException("Run already exists: " + runId);
        }
        JsonChecklistStore store = JsonChecklistStore.create(runId, fileFor(runId), batch);
        stores.put(runId, store);
        return store;
    }

    /**
     * @throws IllegalArgumentException if no checklist exists for the run
     */
    public synchronized ChecklistStore open(String runId) throws ChecklistStoreException {
        validateRunId(runId);
        JsonChecklistStore cached = stores.get(runId);
        if (cached != null) return cached;
        JsonChecklistStore store = JsonChecklistStore.open(runId, fileFor(runId));
        stores.put(runId, store);
        return store;
    }

    /**
     * Drops the cached store of a run that is no longer executing, unless one
     * of its cases still waits for a verdict. A released run is reopened from
     * disk on its next {@link #open}.
     *
     * @return true if the store was dropped
     */
    public synchronized boolean release(String runId) throws ChecklistStoreException {
        JsonChecklistStore cached = stores.get(runId);
        if (cached == null) return false;

        boolean awaitingVerdict = cached.load().stream()
                .anyMatch(c -> c.getStatus() == TestCaseStatus.ESCALATED);
        if (awaitingVerdict) {
            log.debug("[Checklist] Keeping run {} cached: escalations pending", runId);
            return false;
        }
        stores.remove(runId);
        log.debug("[Checklist] Released run {}", runId);
        return true;
    }

    boolean isCached(String runId) {
        return stores.containsKey(runId);
    }

    public boolean exists(String runId) {
        return stores.containsKey(runId)
                || (RUN_ID.matcher(runId).matches() && Files.isRegularFile(fileFor(runId)));
    }

    private Path fileFor(String runId) {
        return checklistDir.resolve(runId + ".json");
    }

    private static void validateRunId(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
    }

    private static void validateBatch(List<TestCase> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("Batch is empty");
        }
        Set<String> ids = new HashSet<>();
        for (TestCase c : batch) {
            if (c.getId() == null || c.getId().isBlank()) {
                throw new IllegalArgumentException("Test case without id");
            }
            if (!ids.add(c.getId())) {
                throw new IllegalArgumentException("Duplicate test case id: " + c.getId());
            }
            String selector = c.getSelector() != null ? c.getSelector() : c.getTestFile();
            if (selector == null || selector.isBlank()) {
                throw new IllegalArgumentException("Test case " + c.getId() + " has no selector or test file");
            }
        }
        for (TestCase c : batch) {
            for (String dep : c.getDependsOn()) {
                if (!ids.contains(dep)) {
                    throw new IllegalArgumentException(
                            "Test case " + c.getId() + " depends on unknown case " + dep);
                }
                if (dep.equals(c.getId())) {
                    throw new IllegalArgumentException("Test case " + c.getId() + " depends on itself");
                }
            }
        }
    }
}
