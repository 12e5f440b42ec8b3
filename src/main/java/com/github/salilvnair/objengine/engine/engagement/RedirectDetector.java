package com.github.salilvnair.objengine.engine.engagement;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects a user steering the conversation elsewhere: a redirect cue together with a
 * keyword of one of the configured topics.
 */
@RequiredArgsConstructor
@Component
public class RedirectDetector {

    private static final Pattern REDIRECT_CUE = Pattern.compile(
            "\\b(actually|wait|but|instead|change topic|talk about)\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectiveEngineFlowConfig flowConfig;

    public RedirectSignal detect(String utterance) {
        ObjectiveEngineFlowConfig.Redirect cfg = flowConfig.getRedirect();
        if (!cfg.isEnabled() || utterance == null || utterance.isBlank()) {
            return RedirectSignal.none();
        }
        if (!REDIRECT_CUE.matcher(utterance).find()) {
            return RedirectSignal.none();
        }
        for (Map.Entry<String, List<String>> topic : cfg.getTopics().entrySet()) {
            if (mentionsAny(utterance, topic.getValue())) {
                return new RedirectSignal(true, topic.getKey(), cfg.getConfidence());
            }
        }
        return RedirectSignal.none();
    }

    private static boolean mentionsAny(String utterance, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return false;
        }
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .anyMatch(k -> Pattern.compile("\\b" + Pattern.quote(k.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
                        .matcher(utterance)
                        .find());
    }
}
