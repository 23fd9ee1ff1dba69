package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.PriorityTier;
import com.migration.planning.waveforge.model.graph.CondensationGraph;
import com.migration.planning.waveforge.model.graph.DependencyGraph;

import java.util.*;

/**
 * Computes and caches the priority key of each condensation unit for one partitioning run.
 * The key only depends on the graph structure, never on assignment state, so it is computed once per unit.
 */
class UnitPriorityRanker<T extends Comparable<? super T>> {

    private final DependencyGraph<T> graph;
    private final CondensationGraph<T> condensation;
    private final PriorityPatternMatcher patterns;
    private final String etlCategory;
    private final Integer transitiveDepthLimit;
    private final Map<Integer, UnitPriority<T>> cache = new HashMap<>();
    private final Comparator<Integer> unitOrder;

    UnitPriorityRanker(DependencyGraph<T> graph, CondensationGraph<T> condensation,
                       PriorityPatternMatcher patterns, String etlCategory, Integer transitiveDepthLimit) {
        this.graph = graph;
        this.condensation = condensation;
        this.patterns = patterns;
        this.etlCategory = etlCategory;
        this.transitiveDepthLimit = transitiveDepthLimit;
        Comparator<UnitPriority<T>> order = UnitPriority.order();
        this.unitOrder = (a, b) -> order.compare(priorityOf(a), priorityOf(b));
    }

    UnitPriority<T> priorityOf(int unitId) {
        return cache.computeIfAbsent(unitId, this::compute);
    }

    boolean isUserPrioritized(int unitId) {
        return priorityOf(unitId).userPrioritized();
    }

    /**
     * Admission order over unit ids. Keys are cached and never change, so the order is stable for sorted sets.
     */
    Comparator<Integer> order() {
        return unitOrder;
    }

    /**
     * Sort unit ids in admission order.
     */
    void sort(List<Integer> unitIds) {
        unitIds.sort(unitOrder);
    }

    private UnitPriority<T> compute(int unitId) {
        List<T> members = condensation.members(unitId);
        boolean userPrioritized = patterns.matchesAny(members);

        boolean allEtl = true;
        int totalDependents = 0;
        for (T member : members) {
            if (!etlCategory.equals(graph.getCategory(member))) {
                allEtl = false;
            }
            totalDependents += graph.getDirectDependents(member).size();
        }

        PriorityTier tier;
        if (userPrioritized) {
            tier = PriorityTier.USER_PRIORITIZED;
        } else if (allEtl) {
            tier = PriorityTier.ETL;
        } else {
            tier = PriorityTier.REGULAR;
        }

        int transitive = condensation.getUnitGraph().getTransitiveDependencies(unitId, transitiveDepthLimit).size();
        return new UnitPriority<>(unitId, tier, userPrioritized, totalDependents, transitive,
                members.size(), condensation.minMember(unitId));
    }
}
