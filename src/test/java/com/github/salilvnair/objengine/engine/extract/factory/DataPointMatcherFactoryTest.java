package com.github.salilvnair.objengine.engine.extract.factory;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import com.github.salilvnair.objengine.engine.extract.provider.InterestsMatcher;
import com.github.salilvnair.objengine.engine.extract.provider.NameMatcher;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

class DataPointMatcherFactoryTest {

    private final DataPointMatcherFactory factory = new DataPointMatcherFactory(List.of(new NameMatcher(), new InterestsMatcher()));

    @Test
    void lookupIsCaseInsensitive() {
        assertInstanceOf(NameMatcher.class, factory.get(DataPointKey.NAME));
        assertInstanceOf(InterestsMatcher.class, factory.get(" Interests "));
    }

    @Test
    void unknownDataPointHasNoMatcher() {
        assertNull(factory.get("favourite_colour"));
        assertNull(factory.get(null));
    }
}
