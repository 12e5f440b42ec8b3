package com.github.salilvnair.objengine.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Component
public class DefinitionCachePreloader {

    private final DefinitionCacheService definitionCacheService;
    private final DefinitionIntegrityValidator integrityValidator;

    @EventListener(ApplicationReadyEvent.class)
    public void preloadCaches() {
        log.info("ObjectiveEngine: Bootstrapping objective and tree definitions into JVM memory.");

        definitionCacheService.getObjectiveLookup();
        definitionCacheService.getTreeLookup();
        List<String> violations = integrityValidator.validate();
        violations.forEach(v -> log.warn("ObjectiveEngine definition integrity: {}", v));

        log.info("ObjectiveEngine: Definition preload complete with {} integrity warning(s).", violations.size());
    }
}
