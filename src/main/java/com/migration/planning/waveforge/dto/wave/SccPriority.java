package com.migration.planning.waveforge.dto.wave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Diagnostic view of one condensation unit's priority key and where it ended up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SccPriority<T> {
    private int unitId;
    private int unitSize;
    private List<T> nodes;
    private PriorityTier priorityTier;
    private int totalDependents;
    private int transitiveDependencies;
    private T minNode;
    private Integer assignedPartition;
    private boolean userPrioritized;
}
