package com.github.salilvnair.objengine.engine.transition.helper;

import com.github.salilvnair.objengine.engine.state.ConversationState;
import com.github.salilvnair.objengine.engine.type.ConditionOperator;
import com.github.salilvnair.objengine.model.condition.ConfidenceCondition;
import com.github.salilvnair.objengine.model.condition.ConversationCondition;
import com.github.salilvnair.objengine.model.condition.DataPresentCondition;
import com.github.salilvnair.objengine.model.condition.MessageCountCondition;
import com.github.salilvnair.objengine.model.condition.PersonaCondition;
import com.github.salilvnair.objengine.model.condition.UserInputCondition;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates routing conditions against conversation state. Pure; unsupported condition
 * types and operators never match.
 */
@Component
public class ConditionEvaluator {

    public boolean anyMatch(List<ConversationCondition> conditions, ConversationState state) {
        return conditions.stream().anyMatch(condition -> evaluate(condition, state));
    }

    public boolean evaluate(ConversationCondition condition, ConversationState state) {
        if (condition == null || state == null) {
            return false;
        }
        Object actual;
        if (condition instanceof PersonaCondition) {
            actual = state.getUserPersona();
        }
        else if (condition instanceof MessageCountCondition) {
            actual = state.getExchangeCount();
        }
        else if (condition instanceof DataPresentCondition dataPresent) {
            actual = state.getDataCollected().get(dataPresent.field());
        }
        else if (condition instanceof ConfidenceCondition confidence) {
            actual = state.getConfidenceScores().get(confidence.field());
        }
        else if (condition instanceof UserInputCondition) {
            actual = state.getLastUserMessage();
        }
        else {
            return false;
        }
        return compare(actual, condition.operator(), condition.value());
    }

    private static boolean compare(Object actual, ConditionOperator op, Object expected) {
        if (op == null) {
            return false;
        }
        return switch (op) {
            case EXISTS -> actual != null;
            case EQUALS -> equalsValue(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case GREATER_THAN -> actual instanceof Number a && expected instanceof Number e
                    && a.doubleValue() > e.doubleValue();
            case LESS_THAN -> actual instanceof Number a && expected instanceof Number e
                    && a.doubleValue() < e.doubleValue();
            case UNSUPPORTED -> false;
        };
    }

    private static boolean equalsValue(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    private static boolean contains(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof String text) {
            return text.contains(String.valueOf(expected));
        }
        if (actual instanceof Collection<?> items) {
            return items.contains(expected);
        }
        return false;
    }
}
