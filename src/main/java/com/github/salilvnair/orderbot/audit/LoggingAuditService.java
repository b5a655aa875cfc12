package com.github.salilvnair.orderbot.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit events to the {@code orderbot.audit} logger.
 */
@Component
public class LoggingAuditService implements AuditService {

    public static final String AUDIT_LOGGER = "orderbot.audit";

    private static final Logger log = LoggerFactory.getLogger(AUDIT_LOGGER);

    @Override
    public void audit(String stage, Long userId, String payloadJson) {
        if (DialogueAuditStage.ENGINE_FAILURE.value().equals(stage)
                || DialogueAuditStage.STEP_ERROR.value().equals(stage)) {
            log.warn("stage={} userId={} payload={}", stage, userId, payloadJson);
            return;
        }
        log.debug("stage={} userId={} payload={}", stage, userId, payloadJson);
    }
}
