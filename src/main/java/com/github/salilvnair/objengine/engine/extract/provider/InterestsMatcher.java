package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class InterestsMatcher extends KeywordCategoryMatcher {

    public InterestsMatcher() {
        category("technology", "\\b(coding|programming|tech|computer|software|apps)\\b");
        category("creative", "\\b(art|design|creative|music|writing|photography)\\b");
        category("people-focused", "\\b(people|helping|teaching|social|communication)\\b");
        category("analytical", "\\b(math|science|analysis|data|research|problem solving)\\b");
        category("practical", "\\b(hands.on|building|making|practical|mechanical)\\b");
        category("business", "\\b(business|entrepreneurship|leadership|management|sales)\\b");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.INTERESTS;
    }
}
