package com.github.salilvnair.orderbot.engine.core;

import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;

public interface DialogueEngine {
    ResponseEnvelope processMessage(Long userId, String message);
}
