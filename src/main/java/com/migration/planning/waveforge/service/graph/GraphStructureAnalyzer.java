package com.migration.planning.waveforge.service.graph;

import com.migration.planning.waveforge.dto.graph.GraphStructureSummary;
import com.migration.planning.waveforge.dto.graph.ObjectDependencyMetrics;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Structural statistics of the dependency graph: component counts and sizes, cycles,
 * roots/leaves, category distribution and per-object fan-in/fan-out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphStructureAnalyzer {

    private final ConnectivityAnalyzer connectivityAnalyzer;

    public <T extends Comparable<? super T>> GraphStructureSummary summarize(DependencyGraph<T> graph) {
        return summarize(graph, connectivityAnalyzer.findStronglyConnectedComponents(graph));
    }

    public <T extends Comparable<? super T>> GraphStructureSummary summarize(DependencyGraph<T> graph,
                                                                             List<Set<T>> components) {
        List<Set<T>> weak = connectivityAnalyzer.findWeaklyConnectedComponents(graph);
        List<Set<T>> cycles = connectivityAnalyzer.findCycles(components);

        Map<String, Integer> categoryCounts = new TreeMap<>();
        for (T node : graph.getNodes()) {
            categoryCounts.merge(graph.getCategory(node), 1, Integer::sum);
        }

        GraphStructureSummary summary = GraphStructureSummary.builder()
                .totalNodes(graph.nodeCount())
                .totalEdges(graph.edgeCount())
                .weaklyConnectedComponents(weak.size())
                .stronglyConnectedComponents(components.size())
                .cycles(cycles.size())
                .rootNodes(graph.getRoots().size())
                .leafNodes(graph.getLeaves().size())
                .weaklyConnectedComponentSizes(sizesDescending(weak))
                .cycleSizes(sizesDescending(cycles))
                .categoryCounts(categoryCounts)
                .build();

        log.info("Graph structure: {} nodes, {} edges, {} weak components, {} SCCs, {} cycles",
                summary.getTotalNodes(), summary.getTotalEdges(), summary.getWeaklyConnectedComponents(),
                summary.getStronglyConnectedComponents(), summary.getCycles());
        return summary;
    }

    /**
     * Per-object dependency metrics in sorted node order.
     * Each object costs two BFS passes; pass a {@code maxDepth} to bound them on very large graphs.
     */
    public <T extends Comparable<? super T>> List<ObjectDependencyMetrics<T>> computeObjectMetrics(
            DependencyGraph<T> graph, Integer maxDepth) {
        List<ObjectDependencyMetrics<T>> metrics = new ArrayList<>(graph.nodeCount());
        for (T node : graph.getSortedNodes()) {
            int direct = graph.getDirectDependencies(node).size();
            int directDependents = graph.getDirectDependents(node).size();
            int total = graph.getTransitiveDependencies(node, maxDepth).size();
            int totalDependents = graph.getTransitiveDependents(node, maxDepth).size();

            metrics.add(ObjectDependencyMetrics.<T>builder()
                    .object(node)
                    .category(graph.getCategory(node))
                    .directDependencies(direct)
                    .directDependents(directDependents)
                    .transitiveOnlyDependencies(Math.max(0, total - direct))
                    .transitiveOnlyDependents(Math.max(0, totalDependents - directDependents))
                    .totalDependencies(total)
                    .totalDependents(totalDependents)
                    .build());
        }
        return metrics;
    }

    private static <T> List<Integer> sizesDescending(List<Set<T>> components) {
        List<Integer> sizes = new ArrayList<>(components.size());
        for (Set<T> component : components) {
            sizes.add(component.size());
        }
        sizes.sort(Comparator.reverseOrder());
        return sizes;
    }
}
