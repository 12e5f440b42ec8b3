package com.github.salilvnair.objengine.engine.evaluate;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.model.CompletionAssessment;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.engine.type.CompletionGate;
import com.github.salilvnair.objengine.engine.type.RecommendedAction;
import com.github.salilvnair.objengine.model.ConversationObjective;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Scores an objective against the collected state and decides whether it is complete.
 * Completion needs every gate: minimum exchanges, confidence threshold, all required data,
 * and the data quality floor. A single-point objective whose point was collected with
 * enough confidence completes on its first exchange.
 */
@RequiredArgsConstructor
@Component
public class CompletionEvaluator {

    private final ObjectiveEngineFlowConfig flowConfig;

    public CompletionAssessment assess(ConversationObjective objective, ConversationState state) {
        ObjectiveEngineFlowConfig.Completion cfg = flowConfig.getCompletion();

        double dataCompletion = dataCompletion(objective, state);
        double confidence = aggregateConfidence(objective, state);
        double quality = dataQuality(state);
        int expected = expectedExchanges(objective);
        double threshold = confidenceThreshold(objective);

        boolean shortCircuit = objective.dataPoints().size() <= 1
                && dataCompletion >= 1.0d
                && confidence >= cfg.getShortCircuitConfidence()
                && state.getExchangeCount() >= 1;

        List<CompletionGate> blocking = new ArrayList<>();
        if (state.getExchangeCount() < expected) {
            blocking.add(CompletionGate.MIN_EXCHANGES);
        }
        if (confidence < threshold) {
            blocking.add(CompletionGate.CONFIDENCE);
        }
        if (dataCompletion < 1.0d) {
            blocking.add(CompletionGate.DATA_COMPLETION);
        }
        if (quality < cfg.getMinDataQuality()) {
            blocking.add(CompletionGate.DATA_QUALITY);
        }

        boolean complete = shortCircuit || blocking.isEmpty();
        return new CompletionAssessment(
                dataCompletion,
                confidence,
                quality,
                expected,
                threshold,
                complete,
                shortCircuit && !blocking.isEmpty(),
                complete ? List.of() : blocking
        );
    }

    public RecommendedAction recommendAction(ConversationObjective objective,
                                             ConversationState state,
                                             CompletionAssessment assessment) {
        ObjectiveEngineFlowConfig.Completion cfg = flowConfig.getCompletion();
        if (assessment.complete()) {
            return RecommendedAction.TRANSITION;
        }
        double escalationLimit = expectedExchanges(objective) * cfg.getEscalationFactor();
        if (state.getExchangeCount() > escalationLimit) {
            return RecommendedAction.ESCALATE;
        }
        if (assessment.confidence() < cfg.getRepeatConfidenceCeiling()
                && state.getExchangeCount() >= cfg.getRepeatMinExchanges()) {
            return RecommendedAction.REPEAT;
        }
        return RecommendedAction.CONTINUE;
    }

    /**
     * Share of required data points holding a non-null value. An objective that requires
     * nothing is fully collected.
     */
    public double dataCompletion(ConversationObjective objective, ConversationState state) {
        List<String> required = objective.dataPoints();
        if (required.isEmpty()) {
            return 1.0d;
        }
        long collected = required.stream().filter(state::hasValue).count();
        return (double) collected / required.size();
    }

    /**
     * Mean confidence over required points that carry a score, scaled by the completion
     * ratio. Zero when no required point has been scored.
     */
    public double aggregateConfidence(ConversationObjective objective, ConversationState state) {
        double total = 0d;
        int scored = 0;
        for (String dataPoint : objective.dataPoints()) {
            Double score = state.getConfidenceScores().get(dataPoint);
            if (score != null) {
                total += score;
                scored++;
            }
        }
        if (scored == 0) {
            return 0d;
        }
        double value = (total / scored) * dataCompletion(objective, state);
        return Math.max(0d, Math.min(1d, value));
    }

    /**
     * Averaged over every collected point, not only those of the given objective.
     */
    public double dataQuality(ConversationState state) {
        if (state.getDataCollected().isEmpty()) {
            return 0d;
        }
        double total = 0d;
        for (Object value : state.getDataCollected().values()) {
            if (value instanceof Collection<?> list) {
                total += Math.min(list.size() / 3.0d, 1.0d);
            }
            else if (value instanceof String text) {
                total += text.length() > 3 ? 0.8d : 0.4d;
            }
            else {
                total += 0.6d;
            }
        }
        return total / state.getDataCollected().size();
    }

    public List<String> missingData(ConversationObjective objective, ConversationState state) {
        return objective.dataPoints().stream()
                .filter(dataPoint -> !state.hasValue(dataPoint))
                .toList();
    }

    public int expectedExchanges(ConversationObjective objective) {
        return objective.averageExchanges() > 0
                ? objective.averageExchanges()
                : flowConfig.getCompletion().getDefaultAverageExchanges();
    }

    public double confidenceThreshold(ConversationObjective objective) {
        double rate = objective.successRate() > 0
                ? objective.successRate()
                : flowConfig.getCompletion().getDefaultSuccessRate();
        return rate / 100d;
    }
}
