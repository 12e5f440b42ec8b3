package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class SkillsMatcher extends KeywordCategoryMatcher {

    private static final String SELF_RATING = "\\b(good at|skilled|talented|strong|confident).{0,20}";

    public SkillsMatcher() {
        category("communication", SELF_RATING + "(communicat|speak|present)");
        category("leadership", SELF_RATING + "(lead|manag|organiz)");
        category("problem-solving", SELF_RATING + "(problem|solv|think|analy)");
        category("creativity", SELF_RATING + "(creat|design|art)");
        category("technical", SELF_RATING + "(tech|comput|program)");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.SKILLS;
    }
}
