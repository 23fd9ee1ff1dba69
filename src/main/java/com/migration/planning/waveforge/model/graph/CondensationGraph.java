package com.migration.planning.waveforge.model.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Acyclic unit graph obtained by collapsing every strongly connected component into one unit.
 *
 * Unit ids are positions in the SCC list (sorted by minimum member). Each unit's member list is sorted.
 * Original node identities are referenced by value, so the source graph may be dropped afterwards.
 */
public class CondensationGraph<T extends Comparable<? super T>> {

    private final List<List<T>> units;
    private final Map<T, Integer> unitByNode;
    private final DependencyGraph<Integer> unitGraph;

    public CondensationGraph(List<List<T>> units, Map<T, Integer> unitByNode, DependencyGraph<Integer> unitGraph) {
        this.units = units;
        this.unitByNode = unitByNode;
        this.unitGraph = unitGraph;
    }

    public int unitCount() {
        return units.size();
    }

    public List<T> members(int unitId) {
        return Collections.unmodifiableList(units.get(unitId));
    }

    public int size(int unitId) {
        return units.get(unitId).size();
    }

    public T minMember(int unitId) {
        return units.get(unitId).get(0);
    }

    public Integer unitOf(T node) {
        return unitByNode.get(node);
    }

    public DependencyGraph<Integer> getUnitGraph() {
        return unitGraph;
    }

    public boolean isCycle(int unitId) {
        return units.get(unitId).size() > 1;
    }
}
