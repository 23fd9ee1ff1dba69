package com.migration.planning.waveforge.dto.wave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of relocating objects between waves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelocationResult<T> {
    private List<WavePartition<T>> partitions;
    private Map<T, Integer> waveAssignments;
    private List<T> movedNodes;   // sorted
}
