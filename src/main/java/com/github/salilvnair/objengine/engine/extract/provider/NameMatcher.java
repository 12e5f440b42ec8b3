package com.github.salilvnair.objengine.engine.extract.provider;

import com.github.salilvnair.objengine.engine.constants.DataPointKey;
import com.github.salilvnair.objengine.engine.extract.core.DataPointMatcher;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class NameMatcher implements DataPointMatcher {

    private static final Pattern EXPLICIT = Pattern.compile("(?:my name is|i'm|call me)\\s+([a-zA-Z]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_TOKEN = Pattern.compile("^([a-zA-Z]+)$");
    private static final Pattern ITS = Pattern.compile("(?:it's|its)\\s+([a-zA-Z]+)", Pattern.CASE_INSENSITIVE);

    // acknowledgements that arrive as a single token but are never a name
    private static final Set<String> FILLER_TOKENS = Set.of(
            "ok", "okay", "yeah", "yes", "yep", "no", "nope", "sure", "fine",
            "hi", "hello", "hey", "thanks", "maybe", "hmm"
    );

    @Override
    public String dataPoint() {
        return DataPointKey.NAME;
    }

    @Override
    public Optional<Object> match(String utterance) {
        if (utterance == null || utterance.isBlank()) {
            return Optional.empty();
        }
        Matcher explicit = EXPLICIT.matcher(utterance);
        if (explicit.find()) {
            return Optional.of(explicit.group(1));
        }
        Matcher bare = BARE_TOKEN.matcher(utterance.trim());
        if (bare.matches() && !FILLER_TOKENS.contains(bare.group(1).toLowerCase(Locale.ROOT))) {
            return Optional.of(bare.group(1));
        }
        Matcher its = ITS.matcher(utterance);
        if (its.find()) {
            return Optional.of(its.group(1));
        }
        return Optional.empty();
    }
}
