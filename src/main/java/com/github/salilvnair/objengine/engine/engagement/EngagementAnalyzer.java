package com.github.salilvnair.objengine.engine.engagement;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.state.ConversationMessage;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Heuristic 0..1 engagement score over the most recent user replies.
 */
@RequiredArgsConstructor
@Component
public class EngagementAnalyzer {

    private static final Set<String> FILLER_REPLIES = Set.of("ok", "yeah", "sure", "fine");

    private final ObjectiveEngineFlowConfig flowConfig;

    public double score(ConversationState state) {
        double score = 0.5d;
        for (ConversationMessage message : state.recentUserMessages(flowConfig.getEngagement().getWindow())) {
            String content = message.content() == null ? "" : message.content();
            if (content.length() > 50) {
                score += 0.2d;
            }
            else if (content.length() < 10) {
                score -= 0.3d;
            }
            if (content.contains("?")) {
                score += 0.1d;
            }
            if (FILLER_REPLIES.contains(content.trim().toLowerCase(Locale.ROOT))) {
                score -= 0.4d;
            }
        }
        return Math.max(0d, Math.min(1d, score));
    }

    public boolean isLow(ConversationState state) {
        ObjectiveEngineFlowConfig.Engagement cfg = flowConfig.getEngagement();
        return cfg.isEnabled() && score(state) < cfg.getLowEngagementThreshold();
    }
}
