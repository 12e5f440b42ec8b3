package com.github.salilvnair.objengine.engine.hook;

import com.github.salilvnair.objengine.engine.model.ObjectiveEvaluation;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class VerboseEvaluationHook implements ObjectiveEvaluationHook {

    @Override
    public void afterEvaluation(String objectiveId, ConversationState state, ObjectiveEvaluation evaluation) {
        if (log.isTraceEnabled()) {
            log.trace("EVALUATION convId={} objective={} exchange={} missing={} reasoning={}",
                    state.getConversationId(), objectiveId, state.getExchangeCount(),
                    evaluation.missingData(), evaluation.reasoning());
        }
    }

    @Override
    public void afterTransitionDecision(String objectiveId, ConversationState state, TransitionDecision decision) {
        if (log.isTraceEnabled()) {
            log.trace("TRANSITION_DECISION convId={} objective={} transition={} target={} reason={}",
                    state.getConversationId(), objectiveId, decision.shouldTransition(),
                    decision.targetObjectiveId(), decision.reason());
        }
    }

    @Override
    public void onEvaluationError(String objectiveId, ConversationState state, Throwable error) {
        log.trace("EVALUATION_ERROR convId={} objective={} errorType={}",
                state.getConversationId(), objectiveId, error == null ? null : error.getClass().getSimpleName());
    }
}
