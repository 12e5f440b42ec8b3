package com.github.salilvnair.objengine.engine.extract.factory;

import com.github.salilvnair.objengine.engine.extract.core.DataPointMatcher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class DataPointMatcherFactory {

    private final Map<String, DataPointMatcher> matchers;

    public DataPointMatcherFactory(List<DataPointMatcher> matchers) {
        this.matchers = matchers.stream()
                .collect(Collectors.toMap(m -> m.dataPoint().toLowerCase(Locale.ROOT), m -> m));
    }

    public DataPointMatcher get(String dataPoint) {
        if (dataPoint == null) {
            return null;
        }
        return matchers.get(dataPoint.trim().toLowerCase(Locale.ROOT));
    }
}
