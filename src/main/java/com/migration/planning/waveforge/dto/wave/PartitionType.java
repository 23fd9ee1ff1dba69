package com.migration.planning.waveforge.dto.wave;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a wave was formed.
 */
public enum PartitionType {
    SIMPLE_OBJECT("simple_object"),        // category-leveling wave, no size limits
    USER_PRIORITIZED("user_prioritized"),  // seeded by a unit matching a prioritization pattern
    REGULAR("regular");

    private final String value;

    PartitionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
