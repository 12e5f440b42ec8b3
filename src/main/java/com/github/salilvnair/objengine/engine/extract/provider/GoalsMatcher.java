package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import org.springframework.stereotype.Component;

@Component
public class GoalsMatcher extends KeywordCategoryMatcher {

    public GoalsMatcher() {
        category("make-impact", "\\b(help|impact|difference|contribute|serve)\\b");
        category("financial-security", "\\b(money|salary|financial|earn|income)\\b");
        category("work-life-balance", "\\b(balance|flexible|family|time|freedom)\\b");
        category("personal-growth", "\\b(learn|grow|develop|challenge|skill)\\b");
        category("creativity-innovation", "\\b(create|build|innovate|invent|start)\\b");
    }

    @Override
    public String dataPoint() {
        return DataPointKey.GOALS;
    }
}
