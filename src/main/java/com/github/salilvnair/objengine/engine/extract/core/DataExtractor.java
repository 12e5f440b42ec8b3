package com.github.salilvnair.objengine.engine.extract.core;

import com.github.salilvnair.objengine.engine.extract.model.ExtractionResult;
import com.github.salilvnair.objengine.model.ConversationObjective;

/**
 * Turns one raw utterance into candidate facts for the data points the objective needs.
 * Implementations must be total: any input, including null, yields a well-formed result.
 */
public interface DataExtractor {

    ExtractionResult extract(String utterance, ConversationObjective objective);
}
