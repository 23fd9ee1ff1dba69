package com.migration.planning.waveforge.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Tunables for a single planning run. Defaults come from {@link WavePlanningProperties}.
 */
@Value
@Builder(toBuilder = true)
public class WavePlanningOptions {

    @Builder.Default
    int minSize = 40;

    @Builder.Default
    int maxSize = 80;

    @Builder.Default
    boolean categoryWaves = true;

    @Builder.Default
    List<String> simpleCategories = List.of("TABLE", "VIEW", "FUNCTION");

    @Builder.Default
    String etlCategory = "ETL";

    @Builder.Default
    List<String> prioritizePatterns = List.of();

    Integer transitiveDepthLimit;

    public static WavePlanningOptions defaults() {
        return WavePlanningOptions.builder().build();
    }

    /**
     * @throws IllegalArgumentException when the size bounds are not positive or min exceeds max
     */
    public void validate() {
        if (minSize < 1 || maxSize < 1) {
            throw new IllegalArgumentException("min-size and max-size must be positive, got "
                    + minSize + "/" + maxSize);
        }
        if (minSize > maxSize) {
            throw new IllegalArgumentException("min-size (" + minSize + ") must not exceed max-size (" + maxSize + ")");
        }
        if (transitiveDepthLimit != null && transitiveDepthLimit < 1) {
            throw new IllegalArgumentException("transitive-depth-limit must be positive when set");
        }
        if (simpleCategories == null || etlCategory == null || prioritizePatterns == null) {
            throw new IllegalArgumentException("simple categories, ETL category and patterns must not be null");
        }
    }
}
