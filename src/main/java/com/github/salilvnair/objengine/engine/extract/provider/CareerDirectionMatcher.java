package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class CareerDirectionMatcher extends OrderedCategoryMatcher {

    public CareerDirectionMatcher() {
        category("uncertain", "\\b(no idea|don't know|not sure|uncertain|confused)\\b");
        category("exploring", "\\b(few ideas|options|considering|thinking about|exploring)\\b");
        category("decided", "\\b(want to|planning|decided|focused on|definitely)\\b");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.CAREER_DIRECTION;
    }
}
