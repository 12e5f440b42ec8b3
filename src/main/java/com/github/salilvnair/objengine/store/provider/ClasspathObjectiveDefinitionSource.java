package com.github.salilvnair.objengine.store.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.objengine.config.ObjectiveEngineDefinitionConfig;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineErrorCode;
import com.github.salilvnair.objengine.engine.exception.ObjectiveEngineException;
import com.github.salilvnair.objengine.model.DefinitionBundle;
import com.github.salilvnair.objengine.store.core.ObjectiveDefinitionSource;
import com.github.salilvnair.objengine.store.parser.ObjectiveDefinitionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@RequiredArgsConstructor
@Component
public class ClasspathObjectiveDefinitionSource implements ObjectiveDefinitionSource {

    private final ObjectiveEngineDefinitionConfig definitionConfig;
    private final ObjectiveDefinitionParser parser;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String name() {
        return definitionConfig.getLocation();
    }

    @Override
    public DefinitionBundle load() {
        String location = definitionConfig.getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            if (definitionConfig.isFailOnMissing()) {
                throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_LOAD_FAILED,
                        "Definition bundle not found at " + location);
            }
            log.warn("Definition bundle not found at {}, continuing with no definitions", location);
            return DefinitionBundle.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = mapper.readTree(in);
            DefinitionBundle bundle = parser.parse(root, location);
            log.info("Loaded {} objectives and {} trees from {}",
                    bundle.objectives().size(), bundle.trees().size(), location);
            return bundle;
        }
        catch (IOException e) {
            throw new ObjectiveEngineException(ObjectiveEngineErrorCode.DEFINITION_LOAD_FAILED,
                    "Failed to read definition bundle at " + location, e);
        }
    }
}
