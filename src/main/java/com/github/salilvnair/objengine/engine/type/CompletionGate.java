package com.github.salilvnair.objengine.engine.type;

public enum CompletionGate {
    MIN_EXCHANGES,
    CONFIDENCE,
    DATA_COMPLETION,
    DATA_QUALITY
}
