package com.github.salilvnair.objengine.engine.state;

import com.github.salilvnair.objengine.engine.type.MessageRole;
import com.github.salilvnair.objengine.engine.type.TransitionReason;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-conversation accumulator. Not thread-safe: callers serialize evaluations for one
 * conversation (see {@code ConversationTurnCoordinator}).
 */
@Getter
public class ConversationState {

    private final String conversationId;
    private final Instant startedAt;

    @Setter
    private String currentTreeId;
    @Setter
    private String currentObjectiveId;
    @Setter
    private String userPersona;

    private String lastUserMessage;
    private int exchangeCount;

    private final Map<String, Object> dataCollected = new LinkedHashMap<>();
    private final Map<String, Double> confidenceScores = new LinkedHashMap<>();
    private final List<ConversationMessage> conversationHistory = new ArrayList<>();
    private final List<String> completedObjectives = new ArrayList<>();
    private final Map<String, TransitionReason> transitionReasons = new LinkedHashMap<>();

    public ConversationState(String conversationId, String currentTreeId, String currentObjectiveId) {
        this.conversationId = conversationId;
        this.currentTreeId = currentTreeId;
        this.currentObjectiveId = currentObjectiveId;
        this.startedAt = Instant.now();
    }

    /**
     * Stores a fact together with its confidence. List values are merged into any list
     * already collected (insertion order, no duplicates) and keep the higher confidence.
     */
    public void mergeFact(String dataPoint, Object value, double confidence) {
        Objects.requireNonNull(dataPoint, "dataPoint");
        Object existing = dataCollected.get(dataPoint);
        if (existing instanceof List<?> existingList && value instanceof List<?> incoming) {
            List<Object> merged = new ArrayList<>(existingList);
            incoming.stream().filter(item -> !merged.contains(item)).forEach(merged::add);
            dataCollected.put(dataPoint, List.copyOf(merged));
            confidenceScores.merge(dataPoint, confidence, Math::max);
            return;
        }
        dataCollected.put(dataPoint, value instanceof List<?> list ? List.copyOf(list) : value);
        confidenceScores.put(dataPoint, confidence);
    }

    public boolean hasValue(String dataPoint) {
        return dataCollected.get(dataPoint) != null;
    }

    public int incrementExchangeCount() {
        return ++exchangeCount;
    }

    public void recordUserMessage(String content, String objectiveId, int maxTurns) {
        this.lastUserMessage = content;
        append(new ConversationMessage(MessageRole.USER, content, Instant.now(), objectiveId), maxTurns);
    }

    public void recordAssistantMessage(String content, int maxTurns) {
        append(new ConversationMessage(MessageRole.ASSISTANT, content, Instant.now(), currentObjectiveId), maxTurns);
    }

    public List<ConversationMessage> recentUserMessages(int limit) {
        List<ConversationMessage> userMessages = conversationHistory.stream()
                .filter(m -> m.role() == MessageRole.USER)
                .toList();
        int from = Math.max(0, userMessages.size() - limit);
        return userMessages.subList(from, userMessages.size());
    }

    /**
     * Moves the active objective pointer. Collected data, confidence and history stay.
     */
    public void advanceObjective(String targetObjectiveId, TransitionReason reason) {
        if (currentObjectiveId != null) {
            if (!completedObjectives.contains(currentObjectiveId)) {
                completedObjectives.add(currentObjectiveId);
            }
            transitionReasons.put(currentObjectiveId, reason);
        }
        this.currentObjectiveId = targetObjectiveId;
    }

    private void append(ConversationMessage message, int maxTurns) {
        conversationHistory.add(message);
        int limit = Math.max(1, maxTurns);
        while (conversationHistory.size() > limit) {
            conversationHistory.remove(0);
        }
    }
}
