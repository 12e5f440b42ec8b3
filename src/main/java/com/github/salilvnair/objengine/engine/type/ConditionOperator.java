package com.github.salilvnair.objengine.engine.type;

import java.util.Arrays;

public enum ConditionOperator {
    EQUALS("equals"),
    CONTAINS("contains"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    EXISTS("exists"),
    UNSUPPORTED("unsupported");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Unknown or blank operator names map to {@link #UNSUPPORTED}, which never matches.
     */
    public static ConditionOperator fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNSUPPORTED;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(op -> op.value.equalsIgnoreCase(trimmed) || op.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(UNSUPPORTED);
    }
}
