package com.github.salilvnair.objengine.model.condition;

import com.github.salilvnair.objengine.engine.type.ConditionOperator;

/**
 * Routing predicate evaluated against conversation state. Each variant carries only
 * the fields its lookup needs.
 */
public sealed interface ConversationCondition
        permits PersonaCondition, MessageCountCondition, DataPresentCondition,
        ConfidenceCondition, UserInputCondition, UnsupportedCondition {

    ConditionOperator operator();

    Object value();
}
