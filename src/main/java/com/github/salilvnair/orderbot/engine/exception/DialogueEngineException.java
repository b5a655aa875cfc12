package com.github.salilvnair.orderbot.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class DialogueEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public DialogueEngineException(DialogueEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogueEngineException(DialogueEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogueEngineException(DialogueEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogueEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}
