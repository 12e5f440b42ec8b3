package com.github.salilvnair.objengine.engine.type;

public enum MessageRole {
    USER,
    ASSISTANT
}
