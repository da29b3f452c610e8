package com.veriheal.orchestrator;

import com.veriheal.communication.EventBus;
import com.veriheal.core.checklist.ChecklistStore;
import com.veriheal.core.checklist.ChecklistStoreException;
import com.veriheal.core.checklist.ChecklistStoreFactory;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level driver of a run.
 *
 * Cases are handed to a fixed pool of workers. Whenever a worker frees up the
 * checklist is re-read and the next eligible cases are scheduled: not
 * terminal, not already in flight, every dependency PASSED; highest priority
 * first, then checklist order. The run ends when nothing is in flight and
 * nothing is eligible.
 */
@Component
public class HealingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HealingOrchestrator.class);

    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ChecklistStoreFactory stores;
    private final CaseProcessor         processor;
    private final EventBus              eventBus;
    private final int                   workers;

    private final Set<String> activeRuns    = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelledRuns = ConcurrentHashMap.newKeySet();

    public HealingOrchestrator(
            ChecklistStoreFactory stores,
            CaseProcessor processor,
            EventBus eventBus,
            @Value("${veriheal.orchestrator.workers:4}") int workers
    ) {
        if (workers < 1) throw new IllegalArgumentException("At least one worker is required");
        this.stores    = stores;
        this.processor = processor;
        this.eventBus  = eventBus;
        this.workers   = workers;
    }

    // =========================================================================
    // ENTRY POINTS
    // =========================================================================

    public RunSummary runOnce(List<TestCase> batch) throws ChecklistStoreException {
        return runOnce(newRunId(), batch);
    }

    /**
     * Persists {@code batch} as a new run and processes it to completion.
     *
     * @throws IllegalArgumentException if the batch is invalid or the run id is taken
     */
    public RunSummary runOnce(String runId, List<TestCase> batch) throws ChecklistStoreException {
        ChecklistStore store = stores.create(runId, batch);
        return execute(store);
    }

    /**
     * Continues a run from its persisted checklist. Cases resume at their last
     * committed status; reopened escalations (verdict FIX) are picked up.
     *
     * @throws IllegalArgumentException if the run does not exist
     * @throws IllegalStateException if the run is already executing
     */
    public RunSummary resume(String runId) throws ChecklistStoreException {
        return execute(stores.open(runId));
    }

    /**
     * Asks an executing run to stop. Workers finish their current step, commit
     * it and stop; nothing new is scheduled.
     *
     * @return false if the run is not executing
     */
    public boolean cancel(String runId) {
        if (!activeRuns.contains(runId)) {
            return false;
        }
        cancelledRuns.add(runId);
        log.info("[Orchestrator] Cancellation requested for run {}", runId);
        return true;
    }

    public boolean isActive(String runId) {
        return activeRuns.contains(runId);
    }

    // =========================================================================
    // SCHEDULING LOOP
    // =========================================================================

    private RunSummary execute(ChecklistStore store) throws ChecklistStoreException {
        String runId = store.runId();
        if (!activeRuns.add(runId)) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        cancelledRuns.remove(runId);
        MdcContext.setRun(runId);

        long startTime = System.currentTimeMillis();
        log.info("========== VERIHEAL RUN {} START ({} workers) ==========", runId, workers);
        eventBus.publish(new Event(EventType.RUN_STARTED, "HealingOrchestrator", runId, null));

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads(runId));
        CompletionService<CaseOutcome> completions = new ExecutorCompletionService<>(pool);
        Set<String> inFlight       = new HashSet<>();
        Map<String, String> fatal  = new LinkedHashMap<>();

        try {
            while (true) {
                if (!isCancelled(runId)) {
                    for (TestCase next : selectEligible(store.load(), inFlight, fatal.keySet())) {
                        if (inFlight.size() >= workers) break;
                        inFlight.add(next.getId());
                        completions.submit(() -> processSafely(store, next.getId()));
                        log.debug("[Orchestrator] Scheduled {} ({})", next.getId(), next.getStatus());
                    }
                }
                if (inFlight.isEmpty()) break;

                CaseOutcome outcome = awaitNext(completions, runId);
                if (outcome == null) continue;
                inFlight.remove(outcome.getCaseId());
                if (outcome.isFatal()) {
                    log.error("[Orchestrator] Case {} aborted: {}", outcome.getCaseId(), outcome.getFatalError());
                    fatal.put(outcome.getCaseId(), outcome.getFatalError());
                }
            }
        } finally {
            shutdown(pool);
            activeRuns.remove(runId);
        }

        boolean cancelled = cancelledRuns.remove(runId);
        RunSummary summary = RunSummary.of(runId, store.load(), fatal, cancelled,
                System.currentTimeMillis() - startTime);

        stores.release(runId);

        log.info("========== VERIHEAL RUN {} END: {} ==========", runId, summary);
        eventBus.publish(new Event(EventType.RUN_FINISHED, "HealingOrchestrator", runId, summary));
        MdcContext.clear();
        return summary;
    }

    /**
     * Eligible cases in scheduling order.
     */
    static List<TestCase> selectEligible(List<TestCase> cases, Set<String> inFlight, Set<String> excluded) {
        Map<String, TestCaseStatus> statusById = new HashMap<>();
        for (TestCase c : cases) statusById.put(c.getId(), c.getStatus());

        List<TestCase> eligible = new ArrayList<>();
        for (TestCase c : cases) {
            if (c.getStatus().isTerminalForScheduling()) continue;
            if (inFlight.contains(c.getId()) || excluded.contains(c.getId())) continue;
            boolean depsPassed = c.getDependsOn().stream()
                    .allMatch(dep -> statusById.get(dep) == TestCaseStatus.PASSED);
            if (depsPassed) eligible.add(c);
        }
        eligible.sort(Comparator.comparingInt(TestCase::getPriority).reversed()
                .thenComparingInt(TestCase::getSequence));
        return eligible;
    }

    private CaseOutcome processSafely(ChecklistStore store, String caseId) {
        MdcContext.setCase(store.runId(), caseId);
        try {
            return processor.process(store, caseId, () -> isCancelled(store.runId()));
        } catch (FatalCaseException e) {
            return CaseOutcome.fatal(caseId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected error processing {}", caseId, e);
            return CaseOutcome.fatal(caseId, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private CaseOutcome awaitNext(CompletionService<CaseOutcome> completions, String runId) {
        try {
            Future<CaseOutcome> done = completions.take();
            return done.get();
        } catch (InterruptedException e) {
            log.warn("[Orchestrator] Interrupted; cancelling run {}", runId);
            cancelledRuns.add(runId);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Run " + runId + " interrupted", e);
        } catch (ExecutionException e) {
            // processSafely never throws; only reachable on an Error
            throw new IllegalStateException("Worker failed in run " + runId, e.getCause());
        }
    }

    private boolean isCancelled(String runId) {
        return cancelledRuns.contains(runId);
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.MINUTES)) {
                log.warn("[Orchestrator] Workers did not stop within 5 minutes");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "veriheal-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String newRunId() {
        return "run-" + LocalDateTime.now().format(RUN_ID_TIME) + "-" + UUID.randomUUID().toString().substring(0, 6);
    }
}
