package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.graph.NodeInfo;
import com.migration.planning.waveforge.dto.wave.PartitionDependency;
import com.migration.planning.waveforge.dto.wave.PartitionType;
import com.migration.planning.waveforge.dto.wave.SccPriority;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PartitionAnalyzerTest {

    private final PartitionAnalyzer analyzer = new PartitionAnalyzer();

    private DependencyGraph<String> graph;
    private List<WavePartition<String>> partitions;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph<>();
        graph.addEdge("A", "B");
        graph.addEdge("B", "C");
        graph.addEdge("D", "C");
        graph.addNodeInfo("B", NodeInfo.ofCategory("VIEW"));

        partitions = List.of(wave(1, "C"), wave(2, "B", "D"), wave(3, "A"));
    }

    @Test
    void dependencyMatrix_countsEdgesFromLaterToEarlierWaves() {
        List<PartitionDependency> matrix = analyzer.buildDependencyMatrix(partitions, graph);

        assertThat(matrix)
                .extracting(PartitionDependency::getSourcePartition, PartitionDependency::getTargetPartition,
                        PartitionDependency::getDependencyCount)
                .containsExactly(tuple(2, 1, 2), tuple(3, 2, 1));
    }

    @Test
    void analyze_fillsPerWaveStatistics() {
        analyzer.analyze(partitions, graph);

        WavePartition<String> first = partitions.get(0);
        assertThat(first.getLeafNodes()).containsExactly("C");
        assertThat(first.getRootNodes()).isEmpty();
        assertThat(first.getExternalDependencies()).isZero();

        WavePartition<String> second = partitions.get(1);
        assertThat(second.getRootNodes()).containsExactly("D");
        assertThat(second.getInternalDependencies()).isZero();
        assertThat(second.getExternalDependencies()).isEqualTo(2);
        assertThat(second.getDependenciesByPartition()).isEqualTo(Map.of(1, 2));
        assertThat(second.getCategoryCounts()).isEqualTo(Map.of("VIEW", 1, NodeInfo.UNKNOWN_CATEGORY, 1));

        WavePartition<String> third = partitions.get(2);
        assertThat(third.getRootNodes()).containsExactly("A");
        assertThat(third.getDependenciesByPartition()).isEqualTo(Map.of(2, 1));
    }

    @Test
    void analyze_countsEdgesInsideAWaveAsInternal() {
        List<WavePartition<String>> single = List.of(wave(1, "C", "B", "D", "A"));

        analyzer.analyze(single, graph);

        assertThat(single.get(0).getInternalDependencies()).isEqualTo(3);
        assertThat(single.get(0).getExternalDependencies()).isZero();
        assertThat(single.get(0).getRootNodes()).containsExactly("A", "D");
    }

    @Test
    void assignPartitions_recordsFinalWaveOfEachUnit() {
        SccPriority<String> b = SccPriority.<String>builder().unitId(1).minNode("B").build();
        SccPriority<String> a = SccPriority.<String>builder().unitId(0).minNode("A").build();

        analyzer.assignPartitions(List.of(b, a), partitions);

        assertThat(b.getAssignedPartition()).isEqualTo(2);
        assertThat(a.getAssignedPartition()).isEqualTo(3);
    }

    private static WavePartition<String> wave(int number, String... nodes) {
        return WavePartition.<String>builder()
                .partitionNumber(number)
                .partitionType(PartitionType.REGULAR)
                .nodes(new ArrayList<>(List.of(nodes)))
                .build();
    }
}
