package com.migration.planning.waveforge.service;

import com.migration.planning.waveforge.config.WavePlanningOptions;
import com.migration.planning.waveforge.dto.graph.DependencyEdge;
import com.migration.planning.waveforge.dto.graph.GraphStructureSummary;
import com.migration.planning.waveforge.dto.graph.NodeInfo;
import com.migration.planning.waveforge.dto.wave.DeploymentPlan;
import com.migration.planning.waveforge.dto.wave.PartitionDependency;
import com.migration.planning.waveforge.dto.wave.PlanViolation;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.CondensationGraph;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import com.migration.planning.waveforge.service.graph.CondensationBuilder;
import com.migration.planning.waveforge.service.graph.ConnectivityAnalyzer;
import com.migration.planning.waveforge.service.graph.GraphStructureAnalyzer;
import com.migration.planning.waveforge.service.wave.PartitionAnalyzer;
import com.migration.planning.waveforge.service.wave.PartitionMerger;
import com.migration.planning.waveforge.service.wave.PartitionValidator;
import com.migration.planning.waveforge.service.wave.PriorityPatternMatcher;
import com.migration.planning.waveforge.service.wave.WavePartitioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Entry point of the planning core: edges and node metadata in, validated deployment plan out.
 *
 * Pipeline: graph → SCCs → condensation → wave partitioning → small-wave merging → analysis → validation.
 * Each call builds and owns its own graph; nothing is shared between calls.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WavePlanningService {

    private final ConnectivityAnalyzer connectivityAnalyzer;
    private final CondensationBuilder condensationBuilder;
    private final GraphStructureAnalyzer graphStructureAnalyzer;
    private final WavePartitioner wavePartitioner;
    private final PartitionMerger partitionMerger;
    private final PartitionAnalyzer partitionAnalyzer;
    private final PartitionValidator partitionValidator;
    private final WavePlanningOptions defaultWavePlanningOptions;

    /**
     * Build the dependency graph from upstream records. Nodes listed in {@code nodeInfo} are registered
     * even when no edge mentions them.
     */
    public <T extends Comparable<? super T>> DependencyGraph<T> buildGraph(Iterable<DependencyEdge<T>> edges,
                                                                         Map<T, NodeInfo> nodeInfo) {
        DependencyGraph<T> graph = new DependencyGraph<>();
        if (nodeInfo != null) {
            nodeInfo.forEach((node, info) -> {
                graph.addNode(node);
                graph.addNodeInfo(node, info);
            });
        }
        int records = 0;
        for (DependencyEdge<T> edge : edges) {
            graph.addEdge(edge.getCaller(), edge.getReferenced());
            records++;
        }
        log.info("Built dependency graph: {} nodes, {} edges from {} records",
                graph.nodeCount(), graph.edgeCount(), records);
        return graph;
    }

    public <T extends Comparable<? super T>> DeploymentPlan<T> plan(Iterable<DependencyEdge<T>> edges,
                                                                   Map<T, NodeInfo> nodeInfo) {
        return plan(buildGraph(edges, nodeInfo), defaultWavePlanningOptions);
    }

    public <T extends Comparable<? super T>> DeploymentPlan<T> plan(Iterable<DependencyEdge<T>> edges,
                                                                   Map<T, NodeInfo> nodeInfo,
                                                                   WavePlanningOptions options) {
        return plan(buildGraph(edges, nodeInfo), options);
    }

    /**
     * Plan deployment waves for an already built graph. The graph is frozen first.
     *
     * @throws IllegalArgumentException for invalid size bounds
     * @throws com.migration.planning.waveforge.exception.MalformedPatternException for a bad prioritization pattern
     * @throws com.migration.planning.waveforge.exception.GraphInconsistencyException when partitioning gets stuck
     */
    public <T extends Comparable<? super T>> DeploymentPlan<T> plan(DependencyGraph<T> graph,
                                                                   WavePlanningOptions options) {
        Objects.requireNonNull(options, "options").validate();
        // fail on bad patterns before any graph work
        PriorityPatternMatcher.compile(options.getPrioritizePatterns());
        graph.freeze();

        List<Set<T>> components = connectivityAnalyzer.findStronglyConnectedComponents(graph);
        List<Set<T>> cycles = connectivityAnalyzer.findCycles(components);
        GraphStructureSummary summary = graphStructureAnalyzer.summarize(graph, components);
        CondensationGraph<T> condensation = condensationBuilder.build(graph, components);

        WavePartitioner.Result<T> result = wavePartitioner.partition(graph, condensation, options);
        List<WavePartition<T>> partitions = partitionMerger.merge(result.partitions(), graph,
                options.getMinSize(), options.getMaxSize());

        partitionAnalyzer.analyze(partitions, graph);
        List<PartitionDependency> matrix = partitionAnalyzer.buildDependencyMatrix(partitions, graph);
        partitionAnalyzer.assignPartitions(result.sccPriorities(), partitions);

        List<PlanViolation> violations = new ArrayList<>(partitionValidator.validate(graph, condensation, partitions));
        violations.addAll(partitionValidator.validateMatrix(matrix));

        List<List<T>> cycleMembers = new ArrayList<>(cycles.size());
        for (Set<T> cycle : cycles) {
            cycleMembers.add(new ArrayList<>(cycle));
        }

        log.info("Deployment plan ready: {} waves, {} matrix cells, {} cycles, {} violations",
                partitions.size(), matrix.size(), cycles.size(), violations.size());

        return DeploymentPlan.<T>builder()
                .partitions(partitions)
                .dependencyMatrix(matrix)
                .sccPriorities(result.sccPriorities())
                .cycles(cycleMembers)
                .graphSummary(summary)
                .violations(violations)
                .build();
    }
}
