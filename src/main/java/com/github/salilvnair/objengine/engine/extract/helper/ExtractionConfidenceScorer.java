package com.github.salilvnair.objengine.engine.extract.helper;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule based confidence for one extracted fact, in [0, 1].
 */
@RequiredArgsConstructor
@Component
public class ExtractionConfidenceScorer {

    static final double BASE = 0.5d;
    static final double EXPLICIT_NAME = 0.95d;
    static final double BARE_NAME = 0.9d;
    static final double STRONG_SENTIMENT = 0.9d;
    static final double SINGLE_INFERRED = 0.7d;
    static final double CORROBORATED = 0.8d;

    private static final Pattern NAME_DISCLOSURE = Pattern.compile("\\b(my name is|i'm|call me)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_TOKEN = Pattern.compile("^[A-Za-z]+$");
    private static final Pattern STRONG_SENTIMENT_WORDS = Pattern.compile("\\b(love|hate|definitely|absolutely)\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectiveEngineFlowConfig flowConfig;

    public double score(String dataPoint, Object value, String utterance) {
        String message = utterance == null ? "" : utterance;
        String key = dataPoint == null ? "" : dataPoint.trim().toLowerCase(Locale.ROOT);
        double confidence = BASE;

        if (DataPointKey.NAME.equals(key)) {
            if (NAME_DISCLOSURE.matcher(message).find()) {
                confidence = EXPLICIT_NAME;
            }
            if (BARE_TOKEN.matcher(message.trim()).matches()) {
                confidence = Math.max(confidence, BARE_NAME);
            }
        }

        if (DataPointKey.WORK_SATISFACTION.equals(key) && STRONG_SENTIMENT_WORDS.matcher(message).find()) {
            confidence = STRONG_SENTIMENT;
        }

        if (value instanceof List<?> list && !list.isEmpty()) {
            confidence = list.size() == 1 ? SINGLE_INFERRED : CORROBORATED;
        }

        ObjectiveEngineFlowConfig.Extraction extraction = flowConfig.getExtraction();
        if (message.length() > extraction.getLongMessageLength()) {
            confidence += extraction.getLongMessageBonus();
        }

        return Math.min(confidence, 1.0d);
    }
}
