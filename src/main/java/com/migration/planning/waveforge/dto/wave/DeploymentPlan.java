package com.migration.planning.waveforge.dto.wave;

import com.migration.planning.waveforge.dto.graph.GraphStructureSummary;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, renumbered deployment schedule handed to downstream formatters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentPlan<T> {

    @Builder.Default
    private List<WavePartition<T>> partitions = new ArrayList<>();

    @Builder.Default
    private List<PartitionDependency> dependencyMatrix = new ArrayList<>();

    @Builder.Default
    private List<SccPriority<T>> sccPriorities = new ArrayList<>();

    @Builder.Default
    private List<List<T>> cycles = new ArrayList<>();

    private GraphStructureSummary graphSummary;

    @Builder.Default
    private List<PlanViolation> violations = new ArrayList<>();

    // node -> partition number, built on the first lookup
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final transient Map<T, Integer> partitionIndex = new HashMap<>();

    public boolean isValid() {
        return violations.isEmpty();
    }

    public void setPartitions(List<WavePartition<T>> partitions) {
        this.partitions = partitions;
        partitionIndex.clear();
    }

    /**
     * Partition number of the node, or {@code null} if it is not part of the plan.
     * Lookups use an index built once from the partitions; replace them with {@link #setPartitions}
     * rather than editing the waves in place.
     */
    public Integer partitionOf(T node) {
        if (partitionIndex.isEmpty()) {
            partitionIndex.putAll(partitionAssignments());
        }
        return partitionIndex.get(node);
    }

    public Map<T, Integer> partitionAssignments() {
        Map<T, Integer> assignments = new HashMap<>();
        for (WavePartition<T> partition : partitions) {
            for (T node : partition.getNodes()) {
                assignments.put(node, partition.getPartitionNumber());
            }
        }
        return assignments;
    }
}
