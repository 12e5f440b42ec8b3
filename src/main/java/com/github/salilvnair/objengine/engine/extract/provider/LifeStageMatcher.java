package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class LifeStageMatcher extends OrderedCategoryMatcher {

    public LifeStageMatcher() {
        category("student", "\\b(student|studying|school|college|university|uni)\\b");
        category("working", "\\b(work|working|job|employed|career)\\b");
        category("graduate", "\\b(graduate|graduated|finished|completed)\\b");
        category("between_opportunities", "\\b(between|looking|searching|unemployed|gap)\\b");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.LIFE_STAGE;
    }
}
