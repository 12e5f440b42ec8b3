package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.extract.core.DataExtractor;
import com.github.salilvnair.objengine.engine.extract.core.DataPointMatcher;
import com.github.salilvnair.objengine.engine.extract.factory.DataPointMatcherFactory;
import com.github.salilvnair.objengine.engine.extract.helper.ExtractionConfidenceScorer;
import com.github.salilvnair.objengine.engine.extract.model.ExtractionResult;
import com.github.salilvnair.objengine.model.ConversationObjective;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword and phrase based extraction. Each required data point is handed to the matcher
 * registered for it; data points without a matcher are skipped.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class PatternDataExtractor implements DataExtractor {

    private final DataPointMatcherFactory matcherFactory;
    private final ExtractionConfidenceScorer confidenceScorer;

    @Override
    public ExtractionResult extract(String utterance, ConversationObjective objective) {
        if (utterance == null || utterance.isBlank() || objective == null) {
            return ExtractionResult.empty();
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (String dataPoint : objective.dataPoints()) {
            DataPointMatcher matcher = matcherFactory.get(dataPoint);
            if (matcher == null) {
                log.debug("No matcher registered for data point '{}' on objective '{}'", dataPoint, objective.id());
                continue;
            }
            Optional<Object> value = matcher.match(utterance);
            value.ifPresent(v -> values.put(dataPoint, v));
        }

        Map<String, Double> confidences = new LinkedHashMap<>();
        values.forEach((dataPoint, value) -> confidences.put(dataPoint, confidenceScorer.score(dataPoint, value, utterance)));

        return new ExtractionResult(values, confidences);
    }
}
