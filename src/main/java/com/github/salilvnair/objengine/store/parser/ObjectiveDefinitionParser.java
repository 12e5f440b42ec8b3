package com.github.salilvnair.objengine.store.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.objengine.engine.constants.ObjectiveEngineValue;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineErrorCode;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineException;
import com.github.salilvnair.objengine.engine.type.ConditionOperator;
import com.github.salilvnair.objengine.model.ConversationObjective;
import com.github.salilvnair.objengine.model.ConversationTree;
import com.github.salilvnair.objengine.model.DefinitionBundle;
import com.github.salilvnair.objengine.model.ObjectiveTransitions;
import com.github.salilvnair.objengine.model.TreeRoute;
import com.github.salilvnair.objengine.model.TreeTransition;
import com.github.salilvnair.objengine.model.condition.ConfidenceCondition;
import com.github.salilvnair.objengine.model.condition.ConversationCondition;
import com.github.salilvnair.objengine.model.condition.DataPresentCondition;
import com.github.salilvnair.objengine.model.condition.MessageCountCondition;
import com.github.salilvnair.objengine.model.condition.PersonaCondition;
import com.github.salilvnair.objengine.model.condition.UnsupportedCondition;
import com.github.salilvnair.objengine.model.condition.UserInputCondition;
import com.github.salilvnair.objengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the raw definition bundle into the typed model. All tolerance for loosely
 * shaped input lives here so the engine only ever sees validated definitions.
 */
@Slf4j
@Component
public class ObjectiveDefinitionParser {

    public DefinitionBundle parse(JsonNode root, String sourceName) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return DefinitionBundle.empty();
        }
        if (!root.isObject()) {
            throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_INVALID,
                    "Definition bundle '" + sourceName + "' must be a JSON object");
        }
        List<ConversationObjective> objectives = new ArrayList<>();
        root.path("objectives").forEach(node -> objectives.add(parseObjective(node)));
        List<ConversationTree> trees = new ArrayList<>();
        root.path("trees").forEach(node -> trees.add(parseTree(node)));
        return new DefinitionBundle(objectives, trees);
    }

    public ConversationObjective parseObjective(JsonNode node) {
        String id = JsonUtil.text(node, "id");
        if (id == null) {
            throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_INVALID,
                    "Objective definition without id: " + node);
        }
        JsonNode dataPointsNode = node.has("dataPoints")
                ? node.get("dataPoints")
                : node.path("completionCriteria").path("requiredDataPoints");
        JsonNode transitions = node.path("transitions");
        return ConversationObjective.builder()
                .id(id)
                .purpose(JsonUtil.text(node, "purpose"))
                .dataPoints(parseDataPoints(dataPointsNode, id))
                .averageExchanges(Math.max(0, node.path("averageExchanges").asInt(0)))
                .successRate(Math.max(0d, node.path("successRate").asDouble(0d)))
                .transitions(new ObjectiveTransitions(
                        JsonUtil.text(transitions, "onSuccess"),
                        JsonUtil.text(transitions, "onTimeout"),
                        JsonUtil.text(transitions, "onUserRedirect")))
                .build();
    }

    /**
     * Accepts a JSON array, a JSON array serialized as a string, or comma separated text.
     * Anything else is split on a best effort basis with a warning.
     */
    public List<String> parseDataPoints(JsonNode node, String objectiveId) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            return textValues(node);
        }
        if (node.isTextual()) {
            String raw = node.asText();
            JsonNode parsed = JsonUtil.parseOrNull(raw);
            if (parsed.isArray()) {
                return textValues(parsed);
            }
            log.warn("Non-JSON dataPoints tolerated for objective '{}': {}", objectiveId, raw);
            return splitLoosely(raw);
        }
        log.warn("Unexpected dataPoints shape for objective '{}': {}", objectiveId, node);
        return splitLoosely(node.toString());
    }

    public ConversationTree parseTree(JsonNode node) {
        String id = JsonUtil.text(node, "id");
        if (id == null) {
            throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_INVALID,
                    "Conversation tree definition without id: " + node);
        }

        List<String> objectiveIds = new ArrayList<>();
        node.path("objectives").forEach(entry -> {
            String objectiveId = entry.isObject() ? JsonUtil.text(entry, "id") : entry.asText(null);
            if (objectiveId != null && !objectiveId.isBlank()) {
                objectiveIds.add(objectiveId.trim());
            }
        });

        Map<String, TreeRoute> routing = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> routes = node.path("routing").fields();
        while (routes.hasNext()) {
            Map.Entry<String, JsonNode> entry = routes.next();
            JsonNode route = entry.getValue();
            routing.put(entry.getKey(), TreeRoute.builder()
                    .success(JsonUtil.text(route, "success"))
                    .timeout(JsonUtil.text(route, "timeout"))
                    .redirect(JsonUtil.text(route, "redirect"))
                    .conditions(parseConditions(route.path("conditions")))
                    .build());
        }

        List<TreeTransition> transitions = new ArrayList<>();
        for (JsonNode transition : node.path("transitions")) {
            String from = JsonUtil.text(transition, "from");
            String to = JsonUtil.text(transition, "to");
            if (from == null || to == null) {
                throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_INVALID,
                        "Transition in tree '" + id + "' needs both 'from' and 'to': " + transition);
            }
            transitions.add(new TreeTransition(from, to, parseConditions(transition.path("conditions"))));
        }

        return ConversationTree.builder()
                .id(id)
                .name(JsonUtil.text(node, "name"))
                .rootObjectiveId(JsonUtil.text(node, "rootObjectiveId"))
                .objectiveIds(objectiveIds)
                .routing(routing)
                .transitions(transitions)
                .build();
    }

    public List<ConversationCondition> parseConditions(JsonNode node) {
        List<ConversationCondition> conditions = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(condition -> conditions.add(parseCondition(condition)));
        }
        return conditions;
    }

    public ConversationCondition parseCondition(JsonNode node) {
        String type = JsonUtil.text(node, "type");
        String field = JsonUtil.text(node, "field");
        ConditionOperator operator = ConditionOperator.fromValue(JsonUtil.text(node, "operator"));
        Object value = JsonUtil.scalar(node.path("value"));

        if (operator == ConditionOperator.UNSUPPORTED) {
            log.warn("Unsupported condition operator '{}' loaded, condition will never match", JsonUtil.text(node, "operator"));
        }
        if (type == null) {
            log.warn("Condition without type loaded, condition will never match: {}", node);
            return new UnsupportedCondition(null);
        }
        switch (type) {
            case ObjectiveEngineValue.CONDITION_PERSONA:
                return new PersonaCondition(operator, value);
            case ObjectiveEngineValue.CONDITION_MESSAGE_COUNT:
                return new MessageCountCondition(operator, value);
            case ObjectiveEngineValue.CONDITION_DATA_PRESENT:
                return new DataPresentCondition(field, operator, value);
            case ObjectiveEngineValue.CONDITION_CONFIDENCE:
                return new ConfidenceCondition(field, operator, value);
            case ObjectiveEngineValue.CONDITION_USER_INPUT:
                return new UserInputCondition(operator, value);
            default:
                log.warn("Unsupported condition type '{}' loaded, condition will never match", type);
                return new UnsupportedCondition(type);
        }
    }

    private static List<String> textValues(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(item -> {
            String text = item.isValueNode() ? item.asText() : null;
            if (text != null && !text.isBlank()) {
                values.add(text.trim());
            }
        });
        return values;
    }

    private static List<String> splitLoosely(String raw) {
        return Arrays.stream(raw.replaceAll("[\\[\\]\"']", "").split("\\s*,\\s*"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
