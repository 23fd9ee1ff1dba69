package com.migration.planning.waveforge.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Default wave planning tunables, bound from the {@code wave-planning.*} section of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "wave-planning")
public class WavePlanningProperties {

    @Min(1)
    private int minSize = 40;

    @Min(1)
    private int maxSize = 80;

    private boolean categoryWaves = true;

    @NotNull
    private List<String> simpleCategories = new ArrayList<>(List.of("TABLE", "VIEW", "FUNCTION"));

    @NotBlank
    private String etlCategory = "ETL";

    @NotNull
    private List<String> prioritizePatterns = new ArrayList<>();

    // unset = unbounded
    @Min(1)
    private Integer transitiveDepthLimit;

    @AssertTrue(message = "min-size must not exceed max-size")
    public boolean isSizeRangeValid() {
        return minSize <= maxSize;
    }

    public WavePlanningOptions toOptions() {
        return WavePlanningOptions.builder()
                .minSize(minSize)
                .maxSize(maxSize)
                .categoryWaves(categoryWaves)
                .simpleCategories(List.copyOf(simpleCategories))
                .etlCategory(etlCategory)
                .prioritizePatterns(List.copyOf(prioritizePatterns))
                .transitiveDepthLimit(transitiveDepthLimit)
                .build();
    }
}
