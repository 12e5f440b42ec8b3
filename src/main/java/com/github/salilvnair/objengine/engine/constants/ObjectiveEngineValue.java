package com.github.salilvnair.objengine.engine.constants;

import java.util.List;

public final class ObjectiveEngineValue {

    private ObjectiveEngineValue() {
    }

    public static final String CONDITION_PERSONA = "persona";
    public static final String CONDITION_MESSAGE_COUNT = "messageCount";
    public static final String CONDITION_DATA_PRESENT = "dataPresent";
    public static final String CONDITION_CONFIDENCE = "confidence";
    public static final String CONDITION_USER_INPUT = "userInput";

    public static final String DEFAULT_DEFINITIONS_LOCATION = "classpath:objengine/definitions.json";
    public static final String DEFAULT_RECOVERY_OBJECTIVE = "reengagement_check";
    public static final String DEFAULT_REDIRECT_OBJECTIVE = "career_exploration";

    public static final List<String> DEFAULT_OBJECTIVE_ORDER = List.of(
            "establish_rapport_collect_name",
            "discover_current_situation",
            "identify_concerns_goals",
            "explore_interests_strengths",
            "generate_career_cards"
    );
}
