package com.github.salilvnair.objengine.engine.state;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import com.github.salilvnair.objengine.engine.type.MessageRole;
import com.github.salilvnair.objengine.engine.type.TransitionReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.objengine.support.TestConstants.CONVERSATION_ID;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_RAPPORT;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_SITUATION;
import static com.github.salilvnair.objengine.support.TestConstants.TREE_ONBOARDING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStateTest {

    private ConversationState state;

    @BeforeEach
    void setUp() {
        state = new ConversationState(CONVERSATION_ID, TREE_ONBOARDING, OBJ_RAPPORT);
    }

    @Test
    void listFactsAccumulateWithoutDuplicatesAndKeepHigherConfidence() {
        state.mergeFact(DataPointKey.INTERESTS, List.of("technology"), 0.8d);
        state.mergeFact(DataPointKey.INTERESTS, List.of("technology", "creative"), 0.7d);

        assertEquals(List.of("technology", "creative"), state.getDataCollected().get(DataPointKey.INTERESTS));
        assertEquals(0.8d, state.getConfidenceScores().get(DataPointKey.INTERESTS));
    }

    @Test
    void scalarFactsOverwrite() {
        state.mergeFact(DataPointKey.NAME, "Tim", 0.9d);
        state.mergeFact(DataPointKey.NAME, "Timothy", 0.5d);

        assertEquals("Timothy", state.getDataCollected().get(DataPointKey.NAME));
        assertEquals(0.5d, state.getConfidenceScores().get(DataPointKey.NAME));
        assertEquals(state.getDataCollected().keySet(), state.getConfidenceScores().keySet());
    }

    @Test
    void historyIsBoundedAndKeepsNewestTurns() {
        for (int i = 0; i < 5; i++) {
            state.recordUserMessage("message " + i, OBJ_RAPPORT, 3);
        }

        assertEquals(3, state.getConversationHistory().size());
        assertEquals("message 2", state.getConversationHistory().get(0).content());
        assertEquals("message 4", state.getLastUserMessage());
    }

    @Test
    void recentUserMessagesSkipAssistantTurns() {
        state.recordUserMessage("first", OBJ_RAPPORT, 20);
        state.recordAssistantMessage("reply", 20);
        state.recordUserMessage("second", OBJ_RAPPORT, 20);

        List<ConversationMessage> recent = state.recentUserMessages(3);

        assertEquals(2, recent.size());
        assertTrue(recent.stream().allMatch(m -> m.role() == MessageRole.USER));
        assertEquals("second", recent.get(1).content());
    }

    @Test
    void advancingRecordsFinishedObjectiveAndKeepsData() {
        state.mergeFact(DataPointKey.NAME, "Tim", 0.9d);

        state.advanceObjective(OBJ_SITUATION, TransitionReason.DATA_SUFFICIENT);

        assertEquals(OBJ_SITUATION, state.getCurrentObjectiveId());
        assertEquals(List.of(OBJ_RAPPORT), state.getCompletedObjectives());
        assertEquals(TransitionReason.DATA_SUFFICIENT, state.getTransitionReasons().get(OBJ_RAPPORT));
        assertEquals("Tim", state.getDataCollected().get(DataPointKey.NAME));
    }
}
