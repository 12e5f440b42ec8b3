package com.github.salilvnair.objengine.model;

import lombok.Builder;

import java.util.List;

/**
 * One discrete conversational sub-goal. {@code averageExchanges} and {@code successRate}
 * use 0 for "not specified"; the completion evaluator substitutes configured defaults.
 * {@code successRate} is a percentage (0-100).
 */
@Builder(toBuilder = true)
public record ConversationObjective(
        String id,
        String purpose,
        List<String> dataPoints,
        int averageExchanges,
        double successRate,
        ObjectiveTransitions transitions
) {

    public ConversationObjective {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
        transitions = transitions == null ? ObjectiveTransitions.none() : transitions;
    }

    public boolean requires(String dataPoint) {
        return dataPoints.contains(dataPoint);
    }
}
