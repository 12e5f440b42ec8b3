package com.github.salilvnair.objengine.engine.engagement;

public record RedirectSignal(
        boolean redirect,
        String suggestedObjectiveId,
        double confidence
) {

    public static RedirectSignal none() {
        return new RedirectSignal(false, null, 0d);
    }
}
