package com.github.salilvnair.objengine.engine.transition;

import com.github.salilvnair.objengine.config.ObjectiveEngineFlowConfig;
import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.engine.transition.helper.ConditionEvaluator;
import com.github.salilvnair.objengine.model.ConversationTree;
import com.github.salilvnair.objengine.model.TreeRoute;
import com.github.salilvnair.objengine.model.TreeTransition;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the objective that follows the current one. Rules are tried in order and the
 * first hit wins:
 * <ol>
 *     <li>tree transitions leaving the objective (conditions, when present, need one match)</li>
 *     <li>the tree routing entry's success target (same condition rule)</li>
 *     <li>the objective's own onSuccess target, when the active tree knows it</li>
 *     <li>the configured linear objective order, one step forward</li>
 * </ol>
 * Returns null when every rule is exhausted.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class TransitionResolver {

    private final ObjectiveDefinitionStore definitionStore;
    private final ConditionEvaluator conditionEvaluator;
    private final ObjectiveEngineFlowConfig flowConfig;

    public String resolveNext(String objectiveId, ConversationState state) {
        Optional<ConversationTree> tree = definitionStore.findTree(state.getCurrentTreeId());

        if (tree.isPresent()) {
            for (TreeTransition transition : tree.get().transitionsFrom(objectiveId)) {
                if (!transition.hasConditions() || conditionEvaluator.anyMatch(transition.conditions(), state)) {
                    log.debug("Objective '{}' resolved to '{}' via tree transition", objectiveId, transition.to());
                    return transition.to();
                }
            }

            Optional<TreeRoute> route = tree.get().routeFor(objectiveId);
            if (route.isPresent() && route.get().success() != null
                    && (!route.get().hasConditions() || conditionEvaluator.anyMatch(route.get().conditions(), state))) {
                log.debug("Objective '{}' resolved to '{}' via tree routing", objectiveId, route.get().success());
                return route.get().success();
            }
        }

        String onSuccess = definitionStore.findObjective(objectiveId)
                .map(objective -> objective.transitions().onSuccess())
                .orElse(null);
        if (acceptable(tree, onSuccess)) {
            log.debug("Objective '{}' resolved to '{}' via onSuccess", objectiveId, onSuccess);
            return onSuccess;
        }

        String linear = nextInFallbackOrder(objectiveId);
        if (linear != null) {
            log.debug("Objective '{}' resolved to '{}' via fallback order", objectiveId, linear);
            return linear;
        }

        log.debug("No next objective for '{}' in tree '{}'", objectiveId, state.getCurrentTreeId());
        return null;
    }

    /**
     * Target for an objective that ran out of exchanges: the routing timeout target, then the
     * objective's onTimeout, then the regular success chain.
     */
    public String resolveTimeout(String objectiveId, ConversationState state) {
        Optional<ConversationTree> tree = definitionStore.findTree(state.getCurrentTreeId());
        String routed = tree.flatMap(t -> t.routeFor(objectiveId)).map(TreeRoute::timeout).orElse(null);
        if (routed != null) {
            return routed;
        }
        String onTimeout = definitionStore.findObjective(objectiveId)
                .map(objective -> objective.transitions().onTimeout())
                .orElse(null);
        if (acceptable(tree, onTimeout)) {
            return onTimeout;
        }
        return resolveNext(objectiveId, state);
    }

    /**
     * Target when the user steers away from the objective. No fallback chain: a redirect
     * without a declared or known target is ignored. A declared target only applies when
     * it is the suggested topic, or when no topic was suggested.
     */
    public String resolveRedirect(String objectiveId, ConversationState state, String suggestedObjectiveId) {
        Optional<ConversationTree> tree = definitionStore.findTree(state.getCurrentTreeId());
        String routed = tree.flatMap(t -> t.routeFor(objectiveId)).map(TreeRoute::redirect).orElse(null);
        if (routed != null && suggests(suggestedObjectiveId, routed)) {
            return routed;
        }
        String onRedirect = definitionStore.findObjective(objectiveId)
                .map(objective -> objective.transitions().onUserRedirect())
                .orElse(null);
        if (acceptable(tree, onRedirect) && suggests(suggestedObjectiveId, onRedirect)) {
            return onRedirect;
        }
        if (suggestedObjectiveId != null && !suggestedObjectiveId.equals(objectiveId)
                && isKnown(suggestedObjectiveId, state)) {
            return suggestedObjectiveId;
        }
        return null;
    }

    /**
     * Known to the active tree, or defined in the store when no tree is active.
     */
    public boolean isKnown(String objectiveId, ConversationState state) {
        if (objectiveId == null) {
            return false;
        }
        Optional<ConversationTree> tree = definitionStore.findTree(state.getCurrentTreeId());
        if (tree.isPresent()) {
            return tree.get().knows(objectiveId);
        }
        return definitionStore.findObjective(objectiveId).isPresent();
    }

    private static boolean suggests(String suggestedObjectiveId, String target) {
        return suggestedObjectiveId == null || suggestedObjectiveId.equals(target);
    }

    private boolean acceptable(Optional<ConversationTree> tree, String objectiveId) {
        if (objectiveId == null) {
            return false;
        }
        return tree.map(t -> t.knows(objectiveId)).orElse(true);
    }

    private String nextInFallbackOrder(String objectiveId) {
        List<String> order = flowConfig.getFallback().getObjectiveOrder();
        if (order == null) {
            return null;
        }
        int index = order.indexOf(objectiveId);
        if (index >= 0 && index < order.size() - 1) {
            return order.get(index + 1);
        }
        return null;
    }
}
