package com.github.salilvnair.objengine.model;

import com.github.salilvnair.objengine.model.condition.ConversationCondition;
import lombok.Builder;

import java.util.List;

@Builder
public record TreeRoute(
        String success,
        String timeout,
        String redirect,
        List<ConversationCondition> conditions
) {

    public TreeRoute {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }
}
