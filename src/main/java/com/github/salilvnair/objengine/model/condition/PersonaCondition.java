package com.github.salilvnair.objengine.model.condition;

import com.github.salilvnair.objengine.engine.type.ConditionOperator;

public record PersonaCondition(ConditionOperator operator, Object value) implements ConversationCondition {
}
