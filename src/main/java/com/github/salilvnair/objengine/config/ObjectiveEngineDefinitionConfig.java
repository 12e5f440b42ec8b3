package com.github.salilvnair.objengine.config;

import com.github.salilvnair.objengine.engine.constants.ObjectiveEngineValue;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "objengine.definitions")
@Getter
@Setter
public class ObjectiveEngineDefinitionConfig {

    /**
     * Spring resource location of the JSON definition bundle.
     */
    private String location = ObjectiveEngineValue.DEFAULT_DEFINITIONS_LOCATION;

    /**
     * When false a missing bundle resource loads as an empty bundle instead of failing.
     */
    private boolean failOnMissing = false;
}
