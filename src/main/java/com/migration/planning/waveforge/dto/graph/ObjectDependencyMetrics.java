package com.migration.planning.waveforge.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dependency fan-in/fan-out figures for one object.
 * Transitive-only counts exclude the direct neighbors; totals include them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectDependencyMetrics<T> {
    private T object;
    private String category;
    private int directDependencies;
    private int directDependents;
    private int transitiveOnlyDependencies;
    private int transitiveOnlyDependents;
    private int totalDependencies;
    private int totalDependents;
}
