package com.github.salilvnair.objengine.engine.extract.model;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Facts pulled from one utterance. {@code values} and {@code confidences} always share
 * the same key set.
 */
public record ExtractionResult(
        Map<String, Object> values,
        Map<String, Double> confidences
) {

    public ExtractionResult {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        confidences = confidences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(confidences));
        if (!values.keySet().equals(confidences.keySet())) {
            throw new IllegalArgumentException("Every extracted value needs exactly one confidence score");
        }
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Flattened view using the {@code <key>_confidence} naming convention.
     */
    public Map<String, Object> toFlatMap() {
        Map<String, Object> flat = new LinkedHashMap<>(values);
        confidences.forEach((key, confidence) -> flat.put(key + DataPointKey.CONFIDENCE_SUFFIX, confidence));
        return flat;
    }
}
