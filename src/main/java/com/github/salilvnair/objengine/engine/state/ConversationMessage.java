package com.github.salilvnair.objengine.engine.state;

import com.github.salilvnair.objengine.engine.type.MessageRole;

import java.time.Instant;

public record ConversationMessage(
        MessageRole role,
        String content,
        Instant timestamp,
        String objectiveId
) {
}
