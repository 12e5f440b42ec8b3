package com.github.salilvnair.objengine.engine.type;

public enum TransitionReason {
    COMPLETION,
    DATA_SUFFICIENT,
    TIMEOUT,
    USER_REDIRECT,
    LOW_ENGAGEMENT,
    NONE
}
