package com.github.salilvnair.objengine.annotation;

import com.github.salilvnair.objengine.config.ObjectiveEngineCacheConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the read-through cache in front of the objective definition sources.
 * This internally triggers Spring's generic
 * {@link org.springframework.cache.annotation.EnableCaching},
 * hooking into the default ConcurrentMapCacheManager or any provider
 * detected on the classpath.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ObjectiveEngineCacheConfiguration.class)
public @interface OeEnableCaching {
}
