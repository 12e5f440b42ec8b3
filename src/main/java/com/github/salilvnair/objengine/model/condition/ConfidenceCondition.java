package com.github.salilvnair.objengine.model.condition;

import com.github.salilvnair.objengine.engine.type.ConditionOperator;

public record ConfidenceCondition(String field, ConditionOperator operator, Object value) implements ConversationCondition {
}
