package io.hivemesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlgorithmType {
    SIMPLE_MAJORITY("simple_majority"),
    CONFIDENCE_WEIGHTED("confidence_weighted"),
    QUADRATIC("quadratic"),
    CONSENSUS("consensus"),
    RANKED_CHOICE("ranked_choice");

    private final String wireName;

    AlgorithmType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AlgorithmType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SIMPLE_MAJORITY;
        }
        String normalized = raw.trim().replace('-', '_');
        for (AlgorithmType value : values()) {
            if (value.wireName.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown voting algorithm: " + raw);
    }
}
