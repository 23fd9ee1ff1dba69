package com.migration.planning.waveforge.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Whole-graph statistics reported alongside a deployment plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStructureSummary {
    private int totalNodes;
    private int totalEdges;
    private int weaklyConnectedComponents;
    private int stronglyConnectedComponents;
    private int cycles;
    private int rootNodes;
    private int leafNodes;
    private List<Integer> weaklyConnectedComponentSizes;  // descending
    private List<Integer> cycleSizes;                     // descending
    private Map<String, Integer> categoryCounts;
}
