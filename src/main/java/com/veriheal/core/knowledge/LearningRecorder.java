package com.veriheal.core.knowledge;

import com.veriheal.communication.HealEventListener;
import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.checklist.PatchRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.checklist.TestCaseStatus;
import com.veriheal.core.escalation.EscalationTicket;
import com.veriheal.core.event.CaseTransition;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.patch.PatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Feeds case outcomes back into the knowledge base: a case that reached
 * PASSED after patches counts as HEALED for its last diagnosed signature, an
 * escalated case counts as ESCALATED.
 */
@Component
public class LearningRecorder implements HealEventListener {

    private static final Logger log = LoggerFactory.getLogger(LearningRecorder.class);

    private final KnowledgeBase knowledgeBase;

    public LearningRecorder(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public void onEvent(Event event) {
        if (event.getType() == EventType.CASE_TRANSITION) {
            CaseTransition transition = event.getPayload(CaseTransition.class);
            if (transition != null && transition.getTo() == TestCaseStatus.PASSED) {
                recordHealed(transition.getSnapshot());
            }
        } else if (event.getType() == EventType.CASE_ESCALATED) {
            EscalationTicket ticket = event.getPayload(EscalationTicket.class);
            if (ticket != null) {
                recordEscalated(ticket);
            }
        }
    }

    private void recordHealed(TestCase testCase) {
        FailureRecord failure = testCase.getLastFailure();
        if (failure == null || !failure.isDiagnosed() || testCase.getPatchHistory().isEmpty()) {
            return;
        }
        List<PatchRecord> history = testCase.getPatchHistory();
        PatchKind kind = history.get(history.size() - 1).getKind();
        record(new FailurePattern(failure.getSignatureKey(), failure.getCategory(), kind,
                FailurePattern.Outcome.HEALED, testCase.getRunId(), testCase.getId(), Instant.now()));
    }

    private void recordEscalated(EscalationTicket ticket) {
        FailureRecord failure = ticket.getLastFailure();
        if (failure == null || !failure.isDiagnosed()) {
            return;
        }
        record(new FailurePattern(failure.getSignatureKey(), failure.getCategory(),
                failure.getRecommendedPatchKind(), FailurePattern.Outcome.ESCALATED,
                ticket.getRunId(), ticket.getCaseId(), Instant.now()));
    }

    private void record(FailurePattern pattern) {
        try {
            knowledgeBase.append(pattern);
        } catch (IOException e) {
            log.warn("[Knowledge] Could not record {} for case {}: {}",
                    pattern.getOutcome(), pattern.getCaseId(), e.getMessage());
        }
    }
}
