package com.github.salilvnair.objengine.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.objengine")
public class ObjectiveEngineAutoConfiguration {
}
