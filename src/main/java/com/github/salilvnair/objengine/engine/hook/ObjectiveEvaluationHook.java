package com.github.salilvnair.objengine.engine.hook;

import com.github.salilvnair.objengine.engine.model.ObjectiveEvaluation;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;

public interface ObjectiveEvaluationHook {

    default void afterEvaluation(String objectiveId, ConversationState state, ObjectiveEvaluation evaluation) {
    }

    default void afterTransitionDecision(String objectiveId, ConversationState state, TransitionDecision decision) {
    }

    default void onEvaluationError(String objectiveId, ConversationState state, Throwable error) {
    }
}
