package com.github.salilvnair.objengine.cache;

import com.github.salilvnair.objengine.model.ConversationObjective;
import com.github.salilvnair.objengine.model.ConversationTree;
import com.github.salilvnair.objengine.model.DefinitionBundle;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionSource;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-through cache in front of every registered definition source. Later sources
 * override earlier ones on id clashes.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class DefinitionCacheService implements ObjectiveDefinitionStore {

    public static final String OBJECTIVE_CACHE = "oe_objective_lookup";
    public static final String TREE_CACHE = "oe_tree_lookup";

    private final List<ObjectiveDefinitionSource> sources;
    @Autowired
    private ObjectProvider<DefinitionCacheService> selfProvider;

    @Cacheable(OBJECTIVE_CACHE)
    public Map<String, ConversationObjective> getObjectiveLookup() {
        Map<String, ConversationObjective> lookup = new LinkedHashMap<>();
        for (ObjectiveDefinitionSource source : sources) {
            DefinitionBundle bundle = source.load();
            bundle.objectives().forEach(objective -> {
                if (lookup.put(objective.id(), objective) != null) {
                    log.warn("Objective '{}' redefined by source {}", objective.id(), source.name());
                }
            });
        }
        return Collections.unmodifiableMap(lookup);
    }

    @Cacheable(TREE_CACHE)
    public Map<String, ConversationTree> getTreeLookup() {
        Map<String, ConversationTree> lookup = new LinkedHashMap<>();
        for (ObjectiveDefinitionSource source : sources) {
            DefinitionBundle bundle = source.load();
            bundle.trees().forEach(tree -> {
                if (lookup.put(tree.id(), tree) != null) {
                    log.warn("Tree '{}' redefined by source {}", tree.id(), source.name());
                }
            });
        }
        return Collections.unmodifiableMap(lookup);
    }

    @CacheEvict(cacheNames = {OBJECTIVE_CACHE, TREE_CACHE}, allEntries = true)
    public void evictAll() {
        log.info("Objective definition caches evicted");
    }

    @Override
    public Optional<ConversationObjective> findObjective(String objectiveId) {
        if (objectiveId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(self().getObjectiveLookup().get(objectiveId));
    }

    @Override
    public Optional<ConversationTree> findTree(String treeId) {
        if (treeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(self().getTreeLookup().get(treeId));
    }

    private DefinitionCacheService self() {
        return selfProvider == null ? this : selfProvider.getIfAvailable(() -> this);
    }
}
