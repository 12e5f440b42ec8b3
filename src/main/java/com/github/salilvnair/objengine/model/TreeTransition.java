package com.github.salilvnair.objengine.model;

import com.github.salilvnair.objengine.model.condition.ConversationCondition;

import java.util.List;

public record TreeTransition(
        String from,
        String to,
        List<ConversationCondition> conditions
) {

    public TreeTransition {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }
}
