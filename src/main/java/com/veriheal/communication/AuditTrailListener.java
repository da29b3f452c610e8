package com.veriheal.communication;

import com.veriheal.core.escalation.EscalationTicket;
import com.veriheal.core.event.CaseTransition;
import com.veriheal.core.event.Event;
import com.veriheal.core.patch.AppliedPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every engine event to the {@code veriheal.audit} logger, one line
 * per event.
 */
@Component
public class AuditTrailListener implements HealEventListener {

    private static final Logger audit = LoggerFactory.getLogger("veriheal.audit");

    @Override
    public void onEvent(Event event) {
        switch (event.getType()) {
            case CASE_TRANSITION -> {
                CaseTransition t = event.getPayload(CaseTransition.class);
                audit.info("[Audit] run={} case={} {} -> {}",
                        event.getRunId(), t.getCaseId(), t.getFrom(), t.getTo());
            }
            case PATCH_APPLIED, PATCH_ROLLED_BACK -> {
                AppliedPatch p = event.getPayload(AppliedPatch.class);
                audit.info("[Audit] run={} case={} {} {} on {}",
                        event.getRunId(), p.getCaseId(), event.getType(), p.getPatchId(), p.getTargetKey());
            }
            case CASE_ESCALATED -> {
                EscalationTicket ticket = event.getPayload(EscalationTicket.class);
                audit.info("[Audit] run={} case={} escalated: {} ({})",
                        event.getRunId(), ticket.getCaseId(), ticket.getReason(), ticket.getDetail());
            }
            default -> audit.info("[Audit] run={} {} from {}: {}",
                    event.getRunId(), event.getType(), event.getSource(), event.getPayload());
        }
    }
}
