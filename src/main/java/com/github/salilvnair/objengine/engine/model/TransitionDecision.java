package com.github.salilvnair.objengine.engine.model;

import com.github.salilvnair.objengine.engine.type.TransitionReason;

public record TransitionDecision(
        boolean shouldTransition,
        String targetObjectiveId,
        TransitionReason reason,
        double confidence,
        boolean preserveContext
) {

    public static TransitionDecision stay(double confidence) {
        return new TransitionDecision(false, null, TransitionReason.NONE, confidence, true);
    }

    public static TransitionDecision moveTo(String targetObjectiveId, TransitionReason reason, double confidence) {
        return new TransitionDecision(true, targetObjectiveId, reason, confidence, true);
    }
}
