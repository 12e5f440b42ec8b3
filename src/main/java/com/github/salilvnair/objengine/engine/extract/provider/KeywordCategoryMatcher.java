package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.extract.core.DataPointMatcher;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Open list data point: every matching keyword category is reported once.
 */
public abstract class KeywordCategoryMatcher implements DataPointMatcher {

    private final Map<String, Pattern> categories = new LinkedHashMap<>();

    protected void category(String value, String regex) {
        categories.put(value, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    @Override
    public Optional<Object> match(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        List<String> matched = categories.entrySet().stream()
                .filter(e -> e.getValue().matcher(utterance).find())
                .map(Map.Entry::getKey)
                .toList();
        return matched.isEmpty() ? Optional.empty() : Optional.of(matched);
    }
}
