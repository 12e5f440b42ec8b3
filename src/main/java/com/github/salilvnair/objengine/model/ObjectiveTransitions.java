package com.github.salilvnair.objengine.model;

public record ObjectiveTransitions(
        String onSuccess,
        String onTimeout,
        String onUserRedirect
) {

    public static ObjectiveTransitions none() {
        return new ObjectiveTransitions(null, null, null);
    }

    public static ObjectiveTransitions onSuccess(String objectiveId) {
        return new ObjectiveTransitions(objectiveId, null, null);
    }
}
