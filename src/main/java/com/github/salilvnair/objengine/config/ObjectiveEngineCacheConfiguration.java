package com.github.salilvnair.objengine.config;

import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
public class ObjectiveEngineCacheConfiguration {
    // Registered through @OeEnableCaching so consumers opt in to the definition read-through cache.
}
