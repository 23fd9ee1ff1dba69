package com.migration.planning.waveforge.dto.wave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-zero cell of the inter-partition matrix: number of edges from nodes of the source (later)
 * partition to nodes of the target (earlier) partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionDependency {
    private int sourcePartition;
    private int targetPartition;
    private int dependencyCount;
}
