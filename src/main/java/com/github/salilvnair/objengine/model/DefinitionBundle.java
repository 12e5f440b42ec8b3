package com.github.salilvnair.objengine.model;

import java.util.List;

public record DefinitionBundle(
        List<ConversationObjective> objectives,
        List<ConversationTree> trees
) {

    public DefinitionBundle {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        trees = trees == null ? List.of() : List.copyOf(trees);
    }

    public static DefinitionBundle empty() {
        return new DefinitionBundle(List.of(), List.of());
    }
}
