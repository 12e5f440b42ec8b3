package com.github.salilvnair.objengine.annotation;

import com.github.salilvnair.objengine.config.ObjectiveEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ObjectiveEngineAutoConfiguration.class)
public @interface EnableObjectiveEngine {
}
