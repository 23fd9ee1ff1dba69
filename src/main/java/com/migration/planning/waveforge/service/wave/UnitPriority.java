package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.PriorityTier;

import java.util.Comparator;

/**
 * Sort key deciding which ready unit seeds the next wave.
 * Ascending by tier, total direct dependents, transitive dependency count (descending),
 * unit size, then smallest member.
 */
record UnitPriority<T extends Comparable<? super T>>(
        int unitId,
        PriorityTier tier,
        boolean userPrioritized,
        int totalDependents,
        int transitiveDependencies,
        int size,
        T minMember
) {

    static <T extends Comparable<? super T>> Comparator<UnitPriority<T>> order() {
        return Comparator.<UnitPriority<T>>comparingInt(p -> p.tier().getLevel())
                .thenComparingInt(UnitPriority::totalDependents)
                .thenComparing(Comparator.<UnitPriority<T>>comparingInt(UnitPriority::transitiveDependencies).reversed())
                .thenComparingInt(UnitPriority::size)
                .thenComparing(UnitPriority::minMember);
    }
}
