package com.github.salilvnair.objengine.engine.model;

import com.github.salilvnair.objengine.engine.type.RecommendedAction;

import java.util.List;

public record ObjectiveEvaluation(
        boolean complete,
        double confidence,
        List<String> missingData,
        List<String> collectedData,
        RecommendedAction recommendedAction,
        String nextObjectiveId,
        String reasoning,
        double dataQuality
) {

    public ObjectiveEvaluation {
        missingData = missingData == null ? List.of() : List.copyOf(missingData);
        collectedData = collectedData == null ? List.of() : List.copyOf(collectedData);
    }

    /**
     * Zero-confidence result returned when the objective could not be evaluated.
     */
    public static ObjectiveEvaluation fallback(String reasoning) {
        return new ObjectiveEvaluation(false, 0d, List.of(), List.of(), RecommendedAction.CONTINUE, null, reasoning, 0d);
    }
}
