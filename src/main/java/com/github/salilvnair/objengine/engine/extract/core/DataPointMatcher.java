package com.github.salilvnair.objengine.engine.extract.core;

import java.util.Optional;

public interface DataPointMatcher {

    String dataPoint();

    /**
     * Return the extracted value, or empty when the utterance carries no evidence.
     */
    Optional<Object> match(String utterance);
}
