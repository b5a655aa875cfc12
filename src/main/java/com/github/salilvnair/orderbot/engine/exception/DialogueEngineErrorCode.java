package com.github.salilvnair.orderbot.engine.exception;

/**
 * Failure categories raised by the engine. Recoverable codes are those a turn can survive by
 * falling back (rule-based extraction instead of the model, an empty session instead of a
 * corrupt one).
 */
public enum DialogueEngineErrorCode {

    // LLM
    LLM_CALL_FAILED("LLM call failed", true),
    LLM_TIMEOUT("LLM call timed out", true),
    LLM_EMPTY_RESPONSE("LLM returned empty response", true),
    PROMPT_RENDER_FAILED("Failed to render prompt template", true),

    // pipeline wiring and execution
    PIPELINE_NO_FINAL_RESULT("Pipeline completed without producing final response", false),
    DUPLICATE_DIALOGUE_STEP("Duplicate DialogueStep bean detected", false),
    MISSING_TERMINAL_STEP("Missing required TerminalStep", false),
    MISSING_DEPENDENT_STEP("DialogueStep dependency is missing", false),
    PIPELINE_DAG_CYCLE("DialogueStep DAG cycle or unsatisfied constraints", false),
    HANDLER_ORDER_VIOLATION("Intent handler registration order is invalid", false),

    // persistence
    SESSION_STATE_CORRUPT("Stored session state could not be read", true),
    MENU_SEED_FAILED("Failed to seed menu", false);

    private final String defaultMessage;
    private final boolean recoverable;

    DialogueEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
