package com.github.salilvnair.objengine.config;

import com.github.salilvnair.objengine.engine.constants.ObjectiveEngineValue;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "objengine.flow")
@Getter
@Setter
public class ObjectiveEngineFlowConfig {

    private Completion completion = new Completion();
    private Extraction extraction = new Extraction();
    private History history = new History();
    private Engagement engagement = new Engagement();
    private Redirect redirect = new Redirect();
    private Fallback fallback = new Fallback();

    @Getter
    @Setter
    public static class Completion {
        private int defaultAverageExchanges = 3;
        private double defaultSuccessRate = 80d;
        private double minDataQuality = 0.6d;
        private double shortCircuitConfidence = 0.7d;
        private double escalationFactor = 1.5d;
        private double repeatConfidenceCeiling = 0.3d;
        private int repeatMinExchanges = 3;
    }

    @Getter
    @Setter
    public static class Extraction {
        private int longMessageLength = 50;
        private double longMessageBonus = 0.1d;
    }

    @Getter
    @Setter
    public static class History {
        private int maxTurns = 20;
    }

    @Getter
    @Setter
    public static class Engagement {
        private boolean enabled = true;
        private int window = 3;
        private double lowEngagementThreshold = 0.2d;
        private String recoveryObjectiveId = ObjectiveEngineValue.DEFAULT_RECOVERY_OBJECTIVE;
    }

    @Getter
    @Setter
    public static class Redirect {
        private boolean enabled = true;
        private double confidence = 0.8d;
        private Map<String, List<String>> topics = defaultTopics();

        private static Map<String, List<String>> defaultTopics() {
            Map<String, List<String>> defaults = new LinkedHashMap<>();
            defaults.put(ObjectiveEngineValue.DEFAULT_REDIRECT_OBJECTIVE, new ArrayList<>(List.of("career", "job", "work", "future")));
            return defaults;
        }
    }

    @Getter
    @Setter
    public static class Fallback {
        private List<String> objectiveOrder = new ArrayList<>(ObjectiveEngineValue.DEFAULT_OBJECTIVE_ORDER);
    }
}
