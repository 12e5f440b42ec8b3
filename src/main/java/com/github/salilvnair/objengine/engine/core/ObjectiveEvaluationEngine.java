package com.github.salilvnair.objengine.engine.core;

import com.github.salilvnair.objengine.engine.model.ObjectiveEvaluation;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;

public interface ObjectiveEvaluationEngine {

    ObjectiveEvaluation evaluateObjective(String objectiveId, ConversationState state, String utterance);

    TransitionDecision evaluateTransition(String objectiveId, ConversationState state, String utterance);

    void applyTransition(ConversationState state, TransitionDecision decision);
}
