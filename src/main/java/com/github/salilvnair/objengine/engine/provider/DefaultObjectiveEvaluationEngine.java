package com.github.salilvnair.objengine.engine.provider;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.core.ObjectiveEvaluationEngine;
import com.github.salilvnair.objengine.engine.engagement.EngagementAnalyzer;
import com.github.salilvnair.objengine.engine.engagement.RedirectDetector;
import com.github.salilvnair.objengine.engine.engagement.RedirectSignal;
import com.github.salilvnair.objengine.engine.evaluate.CompletionEvaluator;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineErrorCode;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineException;
import com.github.salilvnair.objengine.engine.extract.core.DataExtractor;
import com.github.salilvnair.objengine.engine.extract.model.ExtractionResult;
import com.github.salilvnair.objengine.engine.hook.ObjectiveEvaluationHook;
import com.github.salilvnair.objengine.engine.model.CompletionAssessment;
import com.github.salilvnair.objengine.engine.model.ObjectiveEvaluation;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.engine.transition.TransitionResolver;
import com.github.salilvnair.objengine.engine.type.CompletionGate;
import com.github.salilvnair.objengine.engine.type.RecommendedAction;
import com.github.salilvnair.objengine.engine.type.TransitionReason;
import com.github.salilvnair.objengine.model.ConversationObjective;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultObjectiveEvaluationEngine implements ObjectiveEvaluationEngine {

    private final ObjectiveDefinitionStore definitionStore;
    private final DataExtractor dataExtractor;
    private final CompletionEvaluator completionEvaluator;
    private final TransitionResolver transitionResolver;
    private final EngagementAnalyzer engagementAnalyzer;
    private final RedirectDetector redirectDetector;
    private final ObjectiveEngineFlowConfig flowConfig;
    private final List<ObjectiveEvaluationHook> evaluationHooks;

    @Override
    public ObjectiveEvaluation evaluateObjective(String objectiveId, ConversationState state, String utterance) {
        return evaluateSafely(objectiveId, state, utterance).evaluation();
    }

    @Override
    public TransitionDecision evaluateTransition(String objectiveId, ConversationState state, String utterance) {
        TransitionDecision decision;
        try {
            decision = decideTransition(objectiveId, state, utterance);
        }
        catch (Exception e) {
            log.error("Unexpected failure deciding transition from '{}' convId={}", objectiveId, state.getConversationId(), e);
            notifyError(objectiveId, state, e);
            decision = TransitionDecision.stay(0d);
        }
        TransitionDecision finalDecision = decision;
        for (ObjectiveEvaluationHook hook : hooks()) {
            runHookSafely(() -> hook.afterTransitionDecision(objectiveId, state, finalDecision), hook, "afterTransitionDecision", objectiveId);
        }
        return finalDecision;
    }

    @Override
    public void applyTransition(ConversationState state, TransitionDecision decision) {
        if (decision == null || !decision.shouldTransition() || decision.targetObjectiveId() == null) {
            return;
        }
        String from = state.getCurrentObjectiveId();
        state.advanceObjective(decision.targetObjectiveId(), decision.reason());
        log.info("Conversation {} moved from objective '{}' to '{}' reason={}",
                state.getConversationId(), from, decision.targetObjectiveId(), decision.reason());
    }

    private EvaluationOutcome evaluateSafely(String objectiveId, ConversationState state, String utterance) {
        long start = System.nanoTime();
        try {
            ObjectiveEvaluation evaluation = doEvaluate(objectiveId, state, utterance);
            log.debug("Evaluated objective '{}' convId={} complete={} confidence={} action={} in {} ms",
                    objectiveId,
                    state.getConversationId(),
                    evaluation.complete(),
                    evaluation.confidence(),
                    evaluation.recommendedAction(),
                    (System.nanoTime() - start) / 1_000_000);
            for (ObjectiveEvaluationHook hook : hooks()) {
                runHookSafely(() -> hook.afterEvaluation(objectiveId, state, evaluation), hook, "afterEvaluation", objectiveId);
            }
            return new EvaluationOutcome(evaluation, true);
        }
        catch (ObjectiveEngineException e) {
            log.warn("Objective '{}' could not be evaluated convId={} errorCode={} metaData={}: {}",
                    objectiveId, state.getConversationId(), e.getErrorCode(), e.getMetaData(), e.getMessage());
            notifyError(objectiveId, state, e);
            return new EvaluationOutcome(ObjectiveEvaluation.fallback("Evaluation error: " + e.getMessage()), false);
        }
        catch (Exception e) {
            log.error("Unexpected failure evaluating objective '{}' convId={}", objectiveId, state.getConversationId(), e);
            notifyError(objectiveId, state, e);
            return new EvaluationOutcome(ObjectiveEvaluation.fallback("Evaluation error: " + e.getMessage()), false);
        }
    }

    private ObjectiveEvaluation doEvaluate(String objectiveId, ConversationState state, String utterance) {
        ConversationObjective objective = definitionStore.findObjective(objectiveId)
                .orElseThrow(() -> new ObjectiveEngineException(
                        ObjectiveEngineErrorCode.OBJECTIVE_NOT_FOUND,
                        "Objective not found: " + objectiveId
                ).withMetaData(Map.of("objectiveId", String.valueOf(objectiveId))));

        ExtractionResult extracted = dataExtractor.extract(utterance, objective);
        extracted.values().forEach((dataPoint, value) ->
                state.mergeFact(dataPoint, value, extracted.confidences().get(dataPoint)));
        state.recordUserMessage(utterance, objectiveId, flowConfig.getHistory().getMaxTurns());
        state.incrementExchangeCount();

        CompletionAssessment assessment = completionEvaluator.assess(objective, state);
        RecommendedAction action = completionEvaluator.recommendAction(objective, state, assessment);
        List<String> missing = completionEvaluator.missingData(objective, state);
        String next = assessment.complete() ? transitionResolver.resolveNext(objectiveId, state) : null;

        return new ObjectiveEvaluation(
                assessment.complete(),
                assessment.confidence(),
                missing,
                List.copyOf(extracted.values().keySet()),
                action,
                next,
                reasoning(state, assessment, missing),
                assessment.dataQuality()
        );
    }

    private TransitionDecision decideTransition(String objectiveId, ConversationState state, String utterance) {
        EvaluationOutcome outcome = evaluateSafely(objectiveId, state, utterance);
        if (!outcome.evaluated()) {
            return TransitionDecision.stay(0d);
        }
        ObjectiveEvaluation evaluation = outcome.evaluation();
        double confidence = evaluation.confidence();

        if (evaluation.complete()) {
            String target = evaluation.nextObjectiveId();
            if (target == null) {
                log.debug("Objective '{}' complete but no next objective resolved convId={}", objectiveId, state.getConversationId());
                return TransitionDecision.stay(confidence);
            }
            TransitionReason reason = completedByShortCircuit(objectiveId, state)
                    ? TransitionReason.DATA_SUFFICIENT
                    : TransitionReason.COMPLETION;
            return TransitionDecision.moveTo(target, reason, confidence);
        }

        if (evaluation.recommendedAction() == RecommendedAction.ESCALATE) {
            String target = transitionResolver.resolveTimeout(objectiveId, state);
            return target == null
                    ? TransitionDecision.stay(confidence)
                    : TransitionDecision.moveTo(target, TransitionReason.TIMEOUT, confidence);
        }

        // an answer that fills the objective is not a change of topic
        RedirectSignal redirect = evaluation.collectedData().isEmpty()
                ? redirectDetector.detect(utterance)
                : RedirectSignal.none();
        if (redirect.redirect()) {
            String target = transitionResolver.resolveRedirect(objectiveId, state, redirect.suggestedObjectiveId());
            if (target != null) {
                return TransitionDecision.moveTo(target, TransitionReason.USER_REDIRECT, redirect.confidence());
            }
        }

        if (evaluation.recommendedAction() == RecommendedAction.REPEAT && engagementAnalyzer.isLow(state)) {
            String recovery = flowConfig.getEngagement().getRecoveryObjectiveId();
            if (recovery != null && !recovery.equals(objectiveId) && transitionResolver.isKnown(recovery, state)) {
                return TransitionDecision.moveTo(recovery, TransitionReason.LOW_ENGAGEMENT, confidence);
            }
        }

        return TransitionDecision.stay(confidence);
    }

    // the evaluation record does not carry the short-circuit flag, state is unchanged since it was built
    private boolean completedByShortCircuit(String objectiveId, ConversationState state) {
        return definitionStore.findObjective(objectiveId)
                .map(objective -> completionEvaluator.assess(objective, state).shortCircuited())
                .orElse(false);
    }

    private String reasoning(ConversationState state, CompletionAssessment assessment, List<String> missing) {
        if (assessment.complete()) {
            return String.format("Objective completed successfully. Collected %d%% of required data with %d%% confidence after %d exchanges.",
                    percent(assessment.dataCompletion()),
                    percent(assessment.confidence()),
                    state.getExchangeCount());
        }
        List<String> reasons = new ArrayList<>();
        if (assessment.blockedBy(CompletionGate.MIN_EXCHANGES)) {
            reasons.add("Need " + (assessment.expectedExchanges() - state.getExchangeCount()) + " more exchanges");
        }
        if (assessment.blockedBy(CompletionGate.CONFIDENCE)) {
            reasons.add("Confidence too low (" + percent(assessment.confidence()) + "% < "
                    + percent(assessment.confidenceThreshold()) + "%)");
        }
        if (!missing.isEmpty()) {
            reasons.add("Missing data: " + String.join(", ", missing));
        }
        if (assessment.blockedBy(CompletionGate.DATA_QUALITY)) {
            reasons.add("Data quality too low (" + percent(assessment.dataQuality()) + "% < "
                    + percent(flowConfig.getCompletion().getMinDataQuality()) + "%)");
        }
        return "Objective incomplete: " + String.join("; ", reasons) + ".";
    }

    private static long percent(double ratio) {
        return Math.round(ratio * 100);
    }

    private List<ObjectiveEvaluationHook> hooks() {
        return evaluationHooks == null ? List.of() : evaluationHooks;
    }

    private void notifyError(String objectiveId, ConversationState state, Throwable error) {
        for (ObjectiveEvaluationHook hook : hooks()) {
            runHookSafely(() -> hook.onEvaluationError(objectiveId, state, error), hook, "onEvaluationError", objectiveId);
        }
    }

    private void runHookSafely(Runnable hookCall, ObjectiveEvaluationHook hook, String phase, String objectiveId) {
        try {
            hookCall.run();
        }
        catch (Exception ex) {
            log.warn("ObjectiveEvaluationHook {} failed during {} for objective {}: {}",
                    hook.getClass().getSimpleName(), phase, objectiveId, ex.getMessage());
        }
    }

    private record EvaluationOutcome(ObjectiveEvaluation evaluation, boolean evaluated) {
    }
}
