package com.github.salilvnair.objengine.cache;

import com.github.salilvnair.objengine.model.ConversationObjective;
import com.github.salilvnair.objengine.model.ConversationTree;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports tree references to objectives that have no definition. Trees may be partially
 * specified, so violations are reported rather than rejected.
 */
@Component
@RequiredArgsConstructor
public class DefinitionIntegrityValidator {

    private final DefinitionCacheService definitionCacheService;

    public List<String> validate() {
        Map<String, ConversationObjective> objectives = definitionCacheService.getObjectiveLookup();
        List<String> violations = new ArrayList<>();
        for (ConversationTree tree : definitionCacheService.getTreeLookup().values()) {
            if (tree.rootObjectiveId() == null) {
                violations.add("tree=" + tree.id() + " has no rootObjectiveId");
            }
            for (String objectiveId : tree.knownObjectiveIds()) {
                if (!objectives.containsKey(objectiveId)) {
                    violations.add("tree=" + tree.id() + " references undefined objective=" + objectiveId);
                }
            }
        }
        for (ConversationObjective objective : objectives.values()) {
            if (objective.dataPoints().isEmpty()) {
                violations.add("objective=" + objective.id() + " declares no data points and can only advance by escalation");
            }
        }
        return violations;
    }
}
