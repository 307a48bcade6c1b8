package com.example.orchestrator.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class AuditLogEventListener implements OrchestratorEventListener {

    @Override
    public void onLifecycleEvent(OrchestratorEvent event) {
        log.info("[audit] tenant={} conversation={} event={} payload={}",
                event.getTenantId(), event.getConversationId(), event.getType(), event.getPayload());
    }

    @Override
    public void onMessageEvent(MessageRecordedEvent event) {
        if (log.isDebugEnabled() && event.getMessage() != null) {
            log.debug("[audit] tenant={} conversation={} {} message {} status={}",
                    event.getTenantId(),
                    event.getConversationId(),
                    event.getMessage().getDirection(),
                    event.getMessage().getId(),
                    event.getMessage().getDeliveryStatus());
        }
    }
}
