package com.github.salilvnair.orderbot.handler;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;

/**
 * One concrete intent executed against external state. Validation failures are reported
 * through the handler result ({@code success=false, error=...}), not thrown.
 */
public interface IntentHandler {

    String name();

    boolean canHandle(DialogueContext context);

    DialogueContext execute(DialogueContext context);

    /** True for handlers that consume a multi-item batch. */
    default boolean batchCapable() {
        return false;
    }
}
