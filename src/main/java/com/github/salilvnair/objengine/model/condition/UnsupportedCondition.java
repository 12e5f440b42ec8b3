package com.github.salilvnair.objengine.model.condition;

import com.github.salilvnair.objengine.engine.type.ConditionOperator;

/**
 * Loaded in place of a condition whose type is not recognised. Never matches.
 */
public record UnsupportedCondition(String type) implements ConversationCondition {

    @Override
    public ConditionOperator operator() {
        return ConditionOperator.UNSUPPORTED;
    }

    @Override
    public Object value() {
        return null;
    }
}
