package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.extract.core.DataPointMatcher;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Single-valued data point: categories are tried in declaration order and the first
 * matching category wins.
 */
public abstract class OrderedCategoryMatcher implements DataPointMatcher {

    private final Map<String, Pattern> categories = new LinkedHashMap<>();

    protected void category(String value, String regex) {
        categories.put(value, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    @Override
    public Optional<Object> match(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        return categories.entrySet().stream()
                .filter(e -> e.getValue().matcher(utterance).find())
                .<Object>map(Map.Entry::getKey)
                .findFirst();
    }
}
