package com.github.salilvnair.orderbot.audit;

public enum DialogueAuditStage {
    STEP_ENTER,
    STEP_EXIT,
    STEP_ERROR,
    STEP_HOOK_ERROR,
    ENGINE_FAILURE;

    public String value() {
        return name();
    }
}
