package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checklist kept as one pretty-printed JSON document per run.
 *
 * Every mutation rewrites the whole document to a sibling temp file and
 * moves it over the previous one, so the file on disk is always a complete
 * document. Mutations are serialised on this instance; one instance per run
 * is handed out by {@link ChecklistStoreFactory}.
 */
public class JsonChecklistStore implements ChecklistStore {

    private static final Logger log = LoggerFactory.getLogger(JsonChecklistStore.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final String runId;
    private final Path   file;

    // canonical copies, keyed by case id in sequence order
    private final Map<String, TestCase> cases = new LinkedHashMap<>();

    private Instant createdAt;

    private JsonChecklistStore(String runId, Path file) {
        this.runId = runId;
        this.file  = file;
    }

    // ================================================================
    // Lifecycle
    // ================================================================

    /**
     * Persists a new run. Cases are reset to PENDING with sequence numbers in
     * batch order.
     */
    static JsonChecklistStore create(String runId, Path file, List<TestCase> batch)
            throws ChecklistStoreException {

        if (Files.exists(file)) {
            throw new IllegalArgumentException("Run already exists: " + runId);
        }
        JsonChecklistStore store = new JsonChecklistStore(runId, file);
        Instant now = Instant.now();
        store.createdAt = now;

        int sequence = 0;
        for (TestCase definition : batch) {
            TestCase fresh = definition.definitionCopy();
            fresh.initialise(runId, sequence++, now);
            store.cases.put(fresh.getId(), fresh);
        }
        store.flush();
        log.info("[Checklist] Created run {} with {} cases at {}", runId, batch.size(), file);
        return store;
    }

    static JsonChecklistStore open(String runId, Path file) throws ChecklistStoreException {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        JsonChecklistStore store = new JsonChecklistStore(runId, file);
        try {
            ChecklistDocument doc = MAPPER.readValue(file.toFile(), ChecklistDocument.class);
            store.createdAt = doc.createdAt;
            doc.cases.stream()
                    .sorted(Comparator.comparingInt(TestCase::getSequence))
                    .forEach(c -> store.cases.put(c.getId(), c));
        } catch (IOException e) {
            throw new ChecklistStoreException("Failed to read checklist " + file, e);
        }
        log.info("[Checklist] Opened run {} ({} cases)", runId, store.cases.size());
        return store;
    }

    // ================================================================
    // ChecklistStore
    // ================================================================

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public synchronized List<TestCase> load() {
        List<TestCase> copies = new ArrayList<>(cases.size());
        for (TestCase c : cases.values()) copies.add(c.copy());
        copies.sort(Comparator.comparingInt(TestCase::getSequence));
        return copies;
    }

    @Override
    public synchronized Optional<TestCase> find(String caseId) {
        TestCase c = cases.get(caseId);
        return c == null ? Optional.empty() : Optional.of(c.copy());
    }

    @Override
    public synchronized void save(TestCase testCase) throws ChecklistStoreException {
        TestCase current = cases.get(testCase.getId());
        if (current == null) {
            throw new IllegalArgumentException("Unknown test case " + testCase.getId() + " in run " + runId);
        }
        if (current.getStatus() == TestCaseStatus.PASSED && testCase.getStatus() != TestCaseStatus.PASSED) {
            throw new IllegalStateException("Test case " + testCase.getId() + " is PASSED and locked");
        }

        TestCase incoming = testCase.copy();
        // execution history is append-only across writers
        for (ExecutionRecord record : current.getExecutionHistory()) {
            incoming.appendExecutionRecord(record);
        }
        cases.put(incoming.getId(), incoming);
        commitOrRevert(incoming.getId(), current);
        log.debug("[Checklist] Saved {} as {}", incoming.getId(), incoming.getStatus());
    }

    @Override
    public synchronized void appendExecutionRecord(String caseId, ExecutionRecord record)
            throws ChecklistStoreException {
        TestCase current = cases.get(caseId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown test case " + caseId + " in run " + runId);
        }
        TestCase updated = current.copy();
        if (!updated.appendExecutionRecord(record)) {
            log.debug("[Checklist] Execution record {} already present", record.getRecordId());
            return;
        }
        cases.put(caseId, updated);
        commitOrRevert(caseId, current);
    }

    Path getFile() {
        return file;
    }

    // ================================================================
    // Persistence
    // ================================================================

    private void commitOrRevert(String caseId, TestCase previous) throws ChecklistStoreException {
        try {
            flush();
        } catch (ChecklistStoreException e) {
            // memory must keep matching the file
            cases.put(caseId, previous);
            throw e;
        }
    }

    private void flush() throws ChecklistStoreException {
        ChecklistDocument doc = new ChecklistDocument(runId, createdAt, Instant.now(),
                new ArrayList<>(cases.values()));
        Path temp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "." + runId + "-", ".tmp");
            MAPPER.writeValue(temp.toFile(), doc);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new ChecklistStoreException("Failed to write checklist " + file, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("[Checklist] Could not remove temp file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    // ================================================================
    // Document
    // ================================================================

    static final class ChecklistDocument {
        public final String         runId;
        public final Instant        createdAt;
        public final Instant        updatedAt;
        public final List<TestCase> cases;

        @JsonCreator
        ChecklistDocument(
                @JsonProperty("runId")     String         runId,
                @JsonProperty("createdAt") Instant        createdAt,
                @JsonProperty("updatedAt") Instant        updatedAt,
                @JsonProperty("cases")     List<TestCase> cases
        ) {
            this.runId     = runId;
            this.createdAt = createdAt;
            this.updatedAt = updatedAt;
            this.cases     = cases != null ? cases : new ArrayList<>();
        }
    }
}
