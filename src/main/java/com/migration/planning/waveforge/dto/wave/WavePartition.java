package com.migration.planning.waveforge.dto.wave;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

/**
 * One deployment wave: an ordered group of objects whose dependencies all live in this
 * or an earlier wave.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WavePartition<T> {

    private int partitionNumber;

    @Builder.Default
    private List<T> nodes = new ArrayList<>();          // deployment order within the wave

    private PartitionType partitionType;

    @Builder.Default
    private List<Integer> seedUnitIds = new ArrayList<>();

    @Builder.Default
    private List<T> seedNodes = new ArrayList<>();

    // Filled in by PartitionAnalyzer
    @Builder.Default
    private Set<T> rootNodes = new LinkedHashSet<>();
    @Builder.Default
    private Set<T> leafNodes = new LinkedHashSet<>();
    private int internalDependencies;
    private int externalDependencies;
    @Builder.Default
    private Map<Integer, Integer> dependenciesByPartition = new TreeMap<>();
    @Builder.Default
    private Map<String, Integer> categoryCounts = new TreeMap<>();

    public int getSize() {
        return nodes.size();
    }

    @JsonIgnore
    public boolean isSimpleObjectWave() {
        return partitionType == PartitionType.SIMPLE_OBJECT;
    }

    /**
     * Copy with independent node and seed lists, used before a merge mutates them.
     */
    public WavePartition<T> copy() {
        return toBuilder()
                .nodes(new ArrayList<>(nodes))
                .seedUnitIds(new ArrayList<>(seedUnitIds))
                .seedNodes(new ArrayList<>(seedNodes))
                .rootNodes(new LinkedHashSet<>(rootNodes))
                .leafNodes(new LinkedHashSet<>(leafNodes))
                .dependenciesByPartition(new TreeMap<>(dependenciesByPartition))
                .categoryCounts(new TreeMap<>(categoryCounts))
                .build();
    }
}
