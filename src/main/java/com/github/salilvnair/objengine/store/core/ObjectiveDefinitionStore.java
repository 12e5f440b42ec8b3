package com.github.salilvnair.objengine.store.core;

import com.github.salilvnair.objengine.model.ConversationObjective;
import com.github.salilvnair.objengine.model.ConversationTree;

import java.util.Optional;

/**
 * Synchronous lookup of validated definitions. Whatever loads them (file, database,
 * remote service) does so before they are served here.
 */
public interface ObjectiveDefinitionStore {

    Optional<ConversationObjective> findObjective(String objectiveId);

    Optional<ConversationTree> findTree(String treeId);
}
