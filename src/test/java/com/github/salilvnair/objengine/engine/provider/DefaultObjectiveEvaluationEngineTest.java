package com.github.salilvnair.objengine.engine.provider;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import com.github.salilvnair.objengine.engine.engagement.EngagementAnalyzer;
import com.github.salilvnair.objengine.engine.engagement.RedirectDetector;
import com.github.salilvnair.objengine.engine.evaluate.CompletionEvaluator;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineErrorCode;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineException;
import com.github.salilvnair.objengine.engine.extract.core.DataExtractor;
import com.github.salilvnair.objengine.engine.hook.ObjectiveEvaluationHook;
import com.github.salilvnair.objengine.engine.model.ObjectiveEvaluation;
import com.github.salilvnair.objengine.engine.model.TransitionDecision;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.engine.transition.TransitionResolver;
import com.github.salilvnair.objengine.engine.transition.helper.ConditionEvaluator;
import com.github.salilvnair.objengine.engine.type.RecommendedAction;
import com.github.salilvnair.objengine.engine.type.TransitionReason;
import com.github.salilvnair.objengine.support.InMemoryDefinitionStore;
import com.github.salilvnair.objengine.support.TestDefinitions;
import com.github.salilvnair.objengine.support.TestEngines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.objengine.support.TestConstants.BOOM;
import static com.github.salilvnair.objengine.support.TestConstants.CONVERSATION_ID;
import static com.github.salilvnair.objengine.support.TestConstants.DATA_POINT_CAPITALIZED_NAME;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_CAPITALIZED_NAME;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_CAREER_EXPLORATION;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_CONCERNS;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_PROFILE;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_QUICK_NAME;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_RAPPORT;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_REENGAGEMENT;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_SITUATION;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_SLOW;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_UNKNOWN;
import static com.github.salilvnair.objengine.support.TestConstants.OBJ_WRAP_UP;
import static com.github.salilvnair.objengine.support.TestConstants.TREE_ONBOARDING;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_ENJOY_CODING;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_FUTURE_REDIRECT;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_HMM;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_JOB_BUT_HATE;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_OK;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_REDIRECT;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_SARAH;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_SURE;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_TIM;
import static com.github.salilvnair.objengine.support.TestConstants.USER_TEXT_YEAH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultObjectiveEvaluationEngineTest {

    private static final double DELTA = 1e-9;

    @Mock
    private ObjectiveEvaluationHook hook;

    private final ObjectiveEngineFlowConfig flowConfig = new ObjectiveEngineFlowConfig();
    private final InMemoryDefinitionStore store = TestDefinitions.onboardingStore();
    private DefaultObjectiveEvaluationEngine engine;

    @BeforeEach
    void setUp() {
        engine = newEngine(TestEngines.extractor(flowConfig));
    }

    private DefaultObjectiveEvaluationEngine newEngine(DataExtractor extractor) {
        return new DefaultObjectiveEvaluationEngine(
                store,
                extractor,
                new CompletionEvaluator(flowConfig),
                new TransitionResolver(store, new ConditionEvaluator(), flowConfig),
                new EngagementAnalyzer(flowConfig),
                new RedirectDetector(flowConfig),
                flowConfig,
                List.of(hook)
        );
    }

    private static ConversationState stateAt(String treeId, String objectiveId) {
        return new ConversationState(CONVERSATION_ID, treeId, objectiveId);
    }

    @Test
    void singleNameCompletesOnFirstExchange() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);

        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_RAPPORT, state, USER_TEXT_TIM);

        assertEquals("Tim", state.getDataCollected().get(DataPointKey.NAME));
        assertTrue(evaluation.confidence() >= 0.9d);
        assertTrue(evaluation.complete());
        assertEquals(RecommendedAction.TRANSITION, evaluation.recommendedAction());
        assertEquals(OBJ_SITUATION, evaluation.nextObjectiveId());
        assertEquals("Objective completed successfully. Collected 100% of required data with 90% confidence after 1 exchanges.",
                evaluation.reasoning());
        verify(hook).afterEvaluation(OBJ_RAPPORT, state, evaluation);
    }

    @Test
    void partialProfileListsMissingDataAndBlockingReasons() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_PROFILE);

        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_PROFILE, state, USER_TEXT_ENJOY_CODING);

        assertFalse(evaluation.complete());
        assertEquals(List.of(DataPointKey.SKILLS, DataPointKey.GOALS), evaluation.missingData());
        assertNull(evaluation.nextObjectiveId());
        assertEquals("Objective incomplete: Need 2 more exchanges; Confidence too low (23% < 80%); "
                        + "Missing data: skills, goals; Data quality too low (33% < 60%).",
                evaluation.reasoning());
    }

    @Test
    void stuckObjectiveEscalatesAfterFiveExchanges() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_PROFILE);
        ObjectiveEvaluation evaluation = null;
        for (int i = 0; i < 5; i++) {
            evaluation = engine.evaluateObjective(OBJ_PROFILE, state, USER_TEXT_HMM);
        }

        assertEquals(5, state.getExchangeCount());
        assertEquals(RecommendedAction.ESCALATE, evaluation.recommendedAction());
    }

    @Test
    void lowInformationRepliesAskForRepeat() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_CONCERNS);

        engine.evaluateObjective(OBJ_CONCERNS, state, USER_TEXT_OK);
        engine.evaluateObjective(OBJ_CONCERNS, state, USER_TEXT_YEAH);
        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_CONCERNS, state, USER_TEXT_SURE);

        assertEquals(0d, evaluation.confidence(), DELTA);
        assertEquals(RecommendedAction.REPEAT, evaluation.recommendedAction());
    }

    @Test
    void utteranceWithoutDataOnlyAdvancesCountAndHistory() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_PROFILE);
        engine.evaluateObjective(OBJ_PROFILE, state, USER_TEXT_ENJOY_CODING);
        Map<String, Object> dataBefore = Map.copyOf(state.getDataCollected());
        Map<String, Double> confidenceBefore = Map.copyOf(state.getConfidenceScores());

        engine.evaluateObjective(OBJ_PROFILE, state, USER_TEXT_HMM);

        assertEquals(dataBefore, state.getDataCollected());
        assertEquals(confidenceBefore, state.getConfidenceScores());
        assertEquals(2, state.getExchangeCount());
        assertEquals(2, state.getConversationHistory().size());
        assertEquals(USER_TEXT_HMM, state.getLastUserMessage());
    }

    @Test
    void unknownObjectiveReturnsFallbackWithoutTouchingState() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_UNKNOWN);

        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_UNKNOWN, state, USER_TEXT_TIM);

        assertFalse(evaluation.complete());
        assertEquals(0d, evaluation.confidence(), DELTA);
        assertEquals(RecommendedAction.CONTINUE, evaluation.recommendedAction());
        assertEquals(0, state.getExchangeCount());
        assertTrue(state.getConversationHistory().isEmpty());

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(hook).onEvaluationError(eq(OBJ_UNKNOWN), same(state), error.capture());
        ObjectiveEngineException exception = assertInstanceOf(ObjectiveEngineException.class, error.getValue());
        assertEquals(ObjectiveEngineErrorCode.OBJECTIVE_NOT_FOUND.name(), exception.getErrorCode());
    }

    @Test
    void unexpectedFailureNeverEscapesTheEngine() {
        DataExtractor failingExtractor = mock(DataExtractor.class);
        when(failingExtractor.extract(any(), any())).thenThrow(new IllegalStateException(BOOM));
        DefaultObjectiveEvaluationEngine failingEngine = newEngine(failingExtractor);
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);

        ObjectiveEvaluation evaluation = failingEngine.evaluateObjective(OBJ_RAPPORT, state, USER_TEXT_TIM);

        assertEquals(RecommendedAction.CONTINUE, evaluation.recommendedAction());
        assertEquals("Evaluation error: " + BOOM, evaluation.reasoning());
        verify(hook).onEvaluationError(eq(OBJ_RAPPORT), same(state), any(IllegalStateException.class));
    }

    @Test
    void failingHookIsIgnored() {
        doThrow(new IllegalStateException(BOOM)).when(hook).afterEvaluation(any(), any(), any());
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);

        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_RAPPORT, state, USER_TEXT_TIM);

        assertTrue(evaluation.complete());
        assertEquals(1, state.getExchangeCount());
    }

    @Test
    void shortCircuitCompletionTransitionsAsDataSufficient() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);

        TransitionDecision decision = engine.evaluateTransition(OBJ_RAPPORT, state, USER_TEXT_TIM);

        assertTrue(decision.shouldTransition());
        assertEquals(OBJ_SITUATION, decision.targetObjectiveId());
        assertEquals(TransitionReason.DATA_SUFFICIENT, decision.reason());
        assertTrue(decision.preserveContext());
        verify(hook).afterTransitionDecision(OBJ_RAPPORT, state, decision);
    }

    @Test
    void fullCompletionTransitionsAsCompletion() {
        ConversationState state = stateAt(null, OBJ_QUICK_NAME);

        TransitionDecision decision = engine.evaluateTransition(OBJ_QUICK_NAME, state, USER_TEXT_SARAH);

        assertEquals(TransitionReason.COMPLETION, decision.reason());
        assertEquals(OBJ_WRAP_UP, decision.targetObjectiveId());
    }

    @Test
    void escalationTransitionsOnTimeout() {
        ConversationState state = stateAt(null, OBJ_SLOW);

        TransitionDecision first = engine.evaluateTransition(OBJ_SLOW, state, USER_TEXT_HMM);
        TransitionDecision second = engine.evaluateTransition(OBJ_SLOW, state, USER_TEXT_HMM);

        assertFalse(first.shouldTransition());
        assertEquals(TransitionReason.NONE, first.reason());
        assertTrue(second.shouldTransition());
        assertEquals(TransitionReason.TIMEOUT, second.reason());
        assertEquals(OBJ_WRAP_UP, second.targetObjectiveId());
    }

    @Test
    void topicRedirectFollowsTreeRedirect() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_SITUATION);

        TransitionDecision decision = engine.evaluateTransition(OBJ_SITUATION, state, USER_TEXT_FUTURE_REDIRECT);

        assertEquals(TransitionReason.USER_REDIRECT, decision.reason());
        assertEquals(OBJ_CAREER_EXPLORATION, decision.targetObjectiveId());
        assertEquals(0.8d, decision.confidence(), DELTA);
    }

    @Test
    void answerMentioningTopicWordsIsNotARedirect() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_SITUATION);

        TransitionDecision decision = engine.evaluateTransition(OBJ_SITUATION, state, USER_TEXT_JOB_BUT_HATE);

        assertEquals("working", state.getDataCollected().get(DataPointKey.LIFE_STAGE));
        assertEquals("negative", state.getDataCollected().get(DataPointKey.WORK_SATISFACTION));
        assertEquals(1, state.getExchangeCount());
        assertFalse(decision.shouldTransition());
        assertEquals(TransitionReason.NONE, decision.reason());
    }

    @Test
    void redirectToUnknownObjectiveDoesNotTransition() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_UNKNOWN);

        TransitionDecision decision = engine.evaluateTransition(OBJ_UNKNOWN, state, USER_TEXT_REDIRECT);

        assertFalse(decision.shouldTransition());
        assertNull(decision.targetObjectiveId());
        assertEquals(TransitionReason.NONE, decision.reason());
        assertEquals(0d, decision.confidence(), DELTA);
        assertEquals(0, state.getExchangeCount());
        verify(hook).afterTransitionDecision(OBJ_UNKNOWN, state, decision);
    }

    @Test
    void failedEvaluationNeverRedirects() {
        DataExtractor failingExtractor = mock(DataExtractor.class);
        when(failingExtractor.extract(any(), any())).thenThrow(new IllegalStateException(BOOM));
        DefaultObjectiveEvaluationEngine failingEngine = newEngine(failingExtractor);
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_SITUATION);

        TransitionDecision decision = failingEngine.evaluateTransition(OBJ_SITUATION, state, USER_TEXT_FUTURE_REDIRECT);

        assertFalse(decision.shouldTransition());
        assertEquals(OBJ_SITUATION, state.getCurrentObjectiveId());
    }

    @Test
    void dataPointIdsAreScoredCaseInsensitively() {
        store.objective(TestDefinitions.objective(OBJ_CAPITALIZED_NAME, 2, 70, DATA_POINT_CAPITALIZED_NAME));
        ConversationState state = stateAt(null, OBJ_CAPITALIZED_NAME);

        ObjectiveEvaluation evaluation = engine.evaluateObjective(OBJ_CAPITALIZED_NAME, state, USER_TEXT_TIM);

        assertEquals("Tim", state.getDataCollected().get(DATA_POINT_CAPITALIZED_NAME));
        assertEquals(0.9d, evaluation.confidence(), DELTA);
        assertTrue(evaluation.complete());
        assertEquals(List.of(DATA_POINT_CAPITALIZED_NAME), evaluation.collectedData());
    }

    @Test
    void disengagedUserIsRoutedToRecovery() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_CONCERNS);

        assertFalse(engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_OK).shouldTransition());
        assertFalse(engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_YEAH).shouldTransition());
        TransitionDecision decision = engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_SURE);

        assertEquals(TransitionReason.LOW_ENGAGEMENT, decision.reason());
        assertEquals(OBJ_REENGAGEMENT, decision.targetObjectiveId());
    }

    @Test
    void disengagementWithoutKnownRecoveryStays() {
        flowConfig.getEngagement().setRecoveryObjectiveId("not_in_tree");
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_CONCERNS);

        engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_OK);
        engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_YEAH);
        TransitionDecision decision = engine.evaluateTransition(OBJ_CONCERNS, state, USER_TEXT_SURE);

        assertFalse(decision.shouldTransition());
        assertEquals(TransitionReason.NONE, decision.reason());
    }

    @Test
    void applyingATransitionMovesPointerAndKeepsData() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);
        TransitionDecision decision = engine.evaluateTransition(OBJ_RAPPORT, state, USER_TEXT_TIM);

        engine.applyTransition(state, decision);

        assertEquals(OBJ_SITUATION, state.getCurrentObjectiveId());
        assertEquals(List.of(OBJ_RAPPORT), state.getCompletedObjectives());
        assertEquals(TransitionReason.DATA_SUFFICIENT, state.getTransitionReasons().get(OBJ_RAPPORT));
        assertEquals("Tim", state.getDataCollected().get(DataPointKey.NAME));
    }

    @Test
    void applyingANonTransitionChangesNothing() {
        ConversationState state = stateAt(TREE_ONBOARDING, OBJ_RAPPORT);

        engine.applyTransition(state, TransitionDecision.stay(0d));

        assertEquals(OBJ_RAPPORT, state.getCurrentObjectiveId());
        assertTrue(state.getCompletedObjectives().isEmpty());
    }
}
