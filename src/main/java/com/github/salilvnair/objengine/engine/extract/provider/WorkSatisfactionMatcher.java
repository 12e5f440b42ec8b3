package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class WorkSatisfactionMatcher extends OrderedCategoryMatcher {

    public WorkSatisfactionMatcher() {
        category("positive", "\\b(love|enjoy|like|great|good|satisfied)\\b");
        category("negative", "\\b(hate|dislike|boring|terrible|awful|stressed)\\b");
        category("mixed", "\\b(okay|fine|alright|mixed|some good|some bad)\\b");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.WORK_SATISFACTION;
    }
}
