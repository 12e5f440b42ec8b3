package com.github.salilvnair.objengine.engine.exception;

public enum ObjectiveEngineErrorCode {

    // =========================
    // Definition errors
    // =========================
    OBJECTIVE_NOT_FOUND(
            "No objective definition found for the given id",
            true
    ),

    TREE_NOT_FOUND(
            "No conversation tree definition found for the given id",
            true
    ),

    DEFINITION_INVALID(
            "Objective or tree definition is invalid",
            false
    ),

    DEFINITION_LOAD_FAILED(
            "Failed to load objective definitions",
            false
    ),

    // =========================
    // Evaluation errors
    // =========================
    EVALUATION_FAILED(
            "Objective evaluation failed",
            true
    ),

    CONVERSATION_NOT_STARTED(
            "No active conversation for the given id",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ObjectiveEngineErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
