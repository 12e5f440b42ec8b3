package com.github.salilvnair.objengine.engine.model;

import com.github.salilvnair.objengine.engine.type.CompletionGate;

import java.util.List;

public record CompletionAssessment(
        double dataCompletion,
        double confidence,
        double dataQuality,
        int expectedExchanges,
        double confidenceThreshold,
        boolean complete,
        boolean shortCircuited,
        List<CompletionGate> blockingGates
) {

    public CompletionAssessment {
        blockingGates = blockingGates == null ? List.of() : List.copyOf(blockingGates);
    }

    public boolean blockedBy(CompletionGate gate) {
        return blockingGates.contains(gate);
    }
}
