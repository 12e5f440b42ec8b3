package com.github.salilvnair.objengine.engine.type;

public enum RecommendedAction {
    CONTINUE,
    TRANSITION,
    REPEAT,
    ESCALATE
}
