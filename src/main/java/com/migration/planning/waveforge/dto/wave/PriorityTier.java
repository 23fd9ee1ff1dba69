package com.migration.planning.waveforge.dto.wave;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse admission bucket; lower levels are placed in earlier waves.
 */
public enum PriorityTier {
    USER_PRIORITIZED(0, "User-Prioritized"),
    REGULAR(1, "Regular"),
    ETL(2, "ETL");

    private final int level;
    private final String displayName;

    PriorityTier(int level, String displayName) {
        this.level = level;
        this.displayName = displayName;
    }

    public int getLevel() {
        return level;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
