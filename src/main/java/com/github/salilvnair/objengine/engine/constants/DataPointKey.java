package com.github.salilvnair.objengine.engine.constants;

public final class DataPointKey {

    private DataPointKey() {
    }

    public static final String NAME = "name";
    public static final String LIFE_STAGE = "life_stage";
    public static final String CAREER_DIRECTION = "career_direction";
    public static final String WORK_SATISFACTION = "work_satisfaction";
    public static final String INTERESTS = "interests";
    public static final String SKILLS = "skills";
    public static final String GOALS = "goals";

    public static final String CONFIDENCE_SUFFIX = "_confidence";
}
