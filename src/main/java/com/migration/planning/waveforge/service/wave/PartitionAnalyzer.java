package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.PartitionDependency;
import com.migration.planning.waveforge.dto.wave.SccPriority;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Per-wave statistics and the sparse inter-wave dependency matrix.
 *
 * Root and leaf membership use the whole-graph status (a root has no dependents, a leaf has no
 * dependencies), not the status inside the wave.
 */
@Service
@Slf4j
public class PartitionAnalyzer {

    /**
     * Fill root/leaf sets, internal/external dependency counts, the per-source-wave breakdown and the
     * category histogram of every partition. Partitions must already carry their final numbers.
     */
    public <T extends Comparable<? super T>> void analyze(List<WavePartition<T>> partitions, DependencyGraph<T> graph) {
        Map<T, Integer> partitionOf = partitionNumbers(partitions);
        Set<T> roots = new HashSet<>(graph.getRoots());
        Set<T> leaves = new HashSet<>(graph.getLeaves());

        for (WavePartition<T> partition : partitions) {
            Set<T> members = new HashSet<>(partition.getNodes());
            List<T> sorted = new ArrayList<>(partition.getNodes());
            Collections.sort(sorted);

            Set<T> rootNodes = new LinkedHashSet<>();
            Set<T> leafNodes = new LinkedHashSet<>();
            Map<String, Integer> categories = new TreeMap<>();
            Map<Integer, Integer> bySource = new TreeMap<>();
            int internal = 0;
            int external = 0;

            for (T node : sorted) {
                if (roots.contains(node)) {
                    rootNodes.add(node);
                }
                if (leaves.contains(node)) {
                    leafNodes.add(node);
                }
                categories.merge(graph.getCategory(node), 1, Integer::sum);

                for (T dependency : graph.getDirectDependencies(node)) {
                    if (members.contains(dependency)) {
                        internal++;
                    } else {
                        external++;
                        Integer source = partitionOf.get(dependency);
                        if (source != null) {
                            bySource.merge(source, 1, Integer::sum);
                        }
                    }
                }
            }

            partition.setRootNodes(rootNodes);
            partition.setLeafNodes(leafNodes);
            partition.setInternalDependencies(internal);
            partition.setExternalDependencies(external);
            partition.setDependenciesByPartition(bySource);
            partition.setCategoryCounts(categories);
        }
    }

    /**
     * Non-zero counts of edges from a later wave i to an earlier wave j, ordered by (i, j).
     */
    public <T extends Comparable<? super T>> List<PartitionDependency> buildDependencyMatrix(
            List<WavePartition<T>> partitions, DependencyGraph<T> graph) {
        Map<T, Integer> partitionOf = partitionNumbers(partitions);
        Map<Integer, Map<Integer, Integer>> cells = new TreeMap<>();

        for (WavePartition<T> partition : partitions) {
            int source = partition.getPartitionNumber();
            for (T node : partition.getNodes()) {
                for (T dependency : graph.getDirectDependencies(node)) {
                    Integer target = partitionOf.get(dependency);
                    if (target != null && source > target) {
                        cells.computeIfAbsent(source, k -> new TreeMap<>()).merge(target, 1, Integer::sum);
                    }
                }
            }
        }

        List<PartitionDependency> matrix = new ArrayList<>();
        cells.forEach((source, row) -> row.forEach((target, count) ->
                matrix.add(PartitionDependency.builder()
                        .sourcePartition(source)
                        .targetPartition(target)
                        .dependencyCount(count)
                        .build())));
        log.debug("Dependency matrix has {} non-zero cells across {} partitions", matrix.size(), partitions.size());
        return matrix;
    }

    /**
     * Record the final partition number of every ranked unit.
     */
    public <T extends Comparable<? super T>> void assignPartitions(List<SccPriority<T>> ranking,
                                                                  List<WavePartition<T>> partitions) {
        Map<T, Integer> partitionOf = partitionNumbers(partitions);
        for (SccPriority<T> priority : ranking) {
            priority.setAssignedPartition(partitionOf.get(priority.getMinNode()));
        }
    }

    private <T> Map<T, Integer> partitionNumbers(List<WavePartition<T>> partitions) {
        Map<T, Integer> partitionOf = new HashMap<>();
        for (WavePartition<T> partition : partitions) {
            for (T node : partition.getNodes()) {
                partitionOf.put(node, partition.getPartitionNumber());
            }
        }
        return partitionOf;
    }
}
