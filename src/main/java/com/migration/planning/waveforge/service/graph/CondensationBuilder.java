package com.migration.planning.waveforge.service.graph;

import com.migration.planning.waveforge.model.graph.CondensationGraph;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Collapses strongly connected components into single units and derives the unit-level edges.
 * Every cycle becomes one atomic unit, so the partitioner only ever reasons over a DAG.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CondensationBuilder {

    private final ConnectivityAnalyzer connectivityAnalyzer;

    public <T extends Comparable<? super T>> CondensationGraph<T> build(DependencyGraph<T> graph) {
        return build(graph, connectivityAnalyzer.findStronglyConnectedComponents(graph));
    }

    /**
     * Build the condensation from already computed SCCs (ordered by minimum member).
     */
    public <T extends Comparable<? super T>> CondensationGraph<T> build(DependencyGraph<T> graph,
                                                                         List<Set<T>> components) {
        List<List<T>> units = new ArrayList<>(components.size());
        Map<T, Integer> unitByNode = new HashMap<>();
        DependencyGraph<Integer> unitGraph = new DependencyGraph<>();

        for (int unitId = 0; unitId < components.size(); unitId++) {
            List<T> members = new ArrayList<>(components.get(unitId));
            Collections.sort(members);
            units.add(members);
            unitGraph.addNode(unitId);
            for (T member : members) {
                unitByNode.put(member, unitId);
            }
        }

        for (int unitId = 0; unitId < units.size(); unitId++) {
            for (T member : units.get(unitId)) {
                for (T dependency : graph.getDirectDependencies(member)) {
                    Integer target = unitByNode.get(dependency);
                    if (target != null && target != unitId) {
                        unitGraph.addEdge(unitId, target);
                    }
                }
            }
        }
        unitGraph.freeze();

        log.info("Condensed {} nodes into {} units ({} unit edges)",
                graph.nodeCount(), units.size(), unitGraph.edgeCount());
        return new CondensationGraph<>(units, unitByNode, unitGraph);
    }
}
