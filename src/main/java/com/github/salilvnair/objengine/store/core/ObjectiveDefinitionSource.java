package com.github.salilvnair.objengine.store.core;

import com.github.salilvnair.objengine.model.DefinitionBundle;

public interface ObjectiveDefinitionSource {

    String name();

    DefinitionBundle load();
}
