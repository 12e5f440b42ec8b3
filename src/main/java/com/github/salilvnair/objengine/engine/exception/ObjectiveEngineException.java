package com.github.salilvnair.objengine.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ObjectiveEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ObjectiveEngineException(
            ObjectiveEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ObjectiveEngineException(
            ObjectiveEngineErrorCode code,
            String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ObjectiveEngineException(
            ObjectiveEngineErrorCode code,
            String overrideMessage,
            Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ObjectiveEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
