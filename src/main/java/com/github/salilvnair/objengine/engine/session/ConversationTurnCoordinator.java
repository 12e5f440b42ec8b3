package com.github.salilvnair.objengine.engine.session;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.core.ObjectiveEvaluationEngine;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineErrorCode;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineException;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.model.ConversationTree;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of active conversations. Turns of one conversation are serialized on its
 * state; different conversations run in parallel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationTurnCoordinator {

    private final ObjectiveEvaluationEngine evaluationEngine;
    private final ObjectiveDefinitionStore definitionStore;
    private final ObjectiveEngineFlowConfig flowConfig;
    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    /**
     * Starts a conversation at the root objective of the given tree. Starting an id that is
     * already active returns the existing state untouched.
     */
    public ConversationState start(String conversationId, String treeId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
        ConversationTree tree = definitionStore.findTree(treeId)
                .orElseThrow(() -> new ObjectiveEngineException(
                        ObjectiveEngineErrorCode.TREE_NOT_FOUND,
                        "Conversation tree not found: " + treeId));
        return states.computeIfAbsent(conversationId, id -> {
            log.info("Starting conversation {} on tree '{}' at objective '{}'", id, tree.id(), tree.rootObjectiveId());
            return new ConversationState(id, tree.id(), tree.rootObjectiveId());
        });
    }

    public TransitionDecision submitUtterance(String conversationId, String utterance) {
        ConversationState state = require(conversationId);
        synchronized (state) {
            TransitionDecision decision = evaluationEngine.evaluateTransition(state.getCurrentObjectiveId(), state, utterance);
            evaluationEngine.applyTransition(state, decision);
            return decision;
        }
    }

    public void recordAssistantReply(String conversationId, String content) {
        ConversationState state = require(conversationId);
        synchronized (state) {
            state.recordAssistantMessage(content, flowConfig.getHistory().getMaxTurns());
        }
    }

    public Optional<ConversationState> find(String conversationId) {
        return conversationId == null ? Optional.empty() : Optional.ofNullable(states.get(conversationId));
    }

    public ConversationState end(String conversationId) {
        ConversationState removed = conversationId == null ? null : states.remove(conversationId);
        if (removed == null) {
            throw notStarted(conversationId);
        }
        log.info("Ended conversation {} after {} exchanges", conversationId, removed.getExchangeCount());
        return removed;
    }

    private ConversationState require(String conversationId) {
        return find(conversationId).orElseThrow(() -> notStarted(conversationId));
    }

    private static ObjectiveEngineException notStarted(String conversationId) {
        return new ObjectiveEngineException(
                ObjectiveEngineErrorCode.CONVERSATION_NOT_STARTED,
                "No active conversation: " + conversationId);
    }
}
