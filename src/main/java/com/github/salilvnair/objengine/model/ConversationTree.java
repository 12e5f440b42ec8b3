package com.github.salilvnair.objengine.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of objectives for one conversation flow.
 * The {@code routing} map is the canonical shape; {@code transitions} is accepted as an
 * import format and is consulted before routing.
 */
@Builder(toBuilder = true)
public record ConversationTree(
        String id,
        String name,
        String rootObjectiveId,
        List<String> objectiveIds,
        Map<String, TreeRoute> routing,
        List<TreeTransition> transitions
) {

    public ConversationTree {
        objectiveIds = objectiveIds == null ? List.of() : List.copyOf(objectiveIds);
        routing = routing == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(routing));
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public Optional<TreeRoute> routeFor(String objectiveId) {
        return Optional.ofNullable(routing.get(objectiveId));
    }

    public List<TreeTransition> transitionsFrom(String objectiveId) {
        return transitions.stream()
                .filter(t -> Objects.equals(t.from(), objectiveId))
                .toList();
    }

    public Set<String> knownObjectiveIds() {
        Set<String> known = new LinkedHashSet<>();
        addIfPresent(known, rootObjectiveId);
        objectiveIds.forEach(id -> addIfPresent(known, id));
        routing.forEach((from, route) -> {
            addIfPresent(known, from);
            addIfPresent(known, route.success());
            addIfPresent(known, route.timeout());
            addIfPresent(known, route.redirect());
        });
        transitions.forEach(t -> {
            addIfPresent(known, t.from());
            addIfPresent(known, t.to());
        });
        return known;
    }

    public boolean knows(String objectiveId) {
        return objectiveId != null && knownObjectiveIds().contains(objectiveId);
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value);
        }
    }
}
