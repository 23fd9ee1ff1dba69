package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.model.graph.DependencyGraph;

import java.util.*;

/**
 * Which condensation units have been placed in a wave, plus the units that are ready to be placed.
 *
 * A unit is ready when all of its unit-level dependencies are assigned. Readiness is tracked with
 * per-unit counters of unassigned dependencies, so each assignment costs O(out-degree of its dependents).
 * The ready set is kept in the order given at construction, so a caller ranking units by a static key
 * walks its head instead of re-sorting every time.
 * One instance belongs to one partitioning run and is handed from phase to phase.
 */
public class AssignmentState {

    private final DependencyGraph<Integer> unitGraph;
    private final BitSet assigned;
    private final int[] pendingDependencies;
    private final TreeSet<Integer> ready;
    private final int unitCount;
    private int assignedCount;

    public AssignmentState(DependencyGraph<Integer> unitGraph, int unitCount) {
        this(unitGraph, unitCount, Comparator.naturalOrder());
    }

    /**
     * @param readyOrder total order over unit ids; it must not change while units are ready
     */
    public AssignmentState(DependencyGraph<Integer> unitGraph, int unitCount, Comparator<Integer> readyOrder) {
        this.unitGraph = unitGraph;
        this.ready = new TreeSet<>(readyOrder);
        this.unitCount = unitCount;
        this.assigned = new BitSet(unitCount);
        this.pendingDependencies = new int[unitCount];
        for (int unit = 0; unit < unitCount; unit++) {
            pendingDependencies[unit] = unitGraph.getDirectDependencies(unit).size();
            if (pendingDependencies[unit] == 0) {
                ready.add(unit);
            }
        }
    }

    public boolean isAssigned(int unit) {
        return assigned.get(unit);
    }

    public void assign(int unit) {
        if (assigned.get(unit)) {
            throw new IllegalStateException("Unit " + unit + " is already assigned");
        }
        assigned.set(unit);
        assignedCount++;
        ready.remove(unit);
        for (Integer dependent : unitGraph.getDirectDependents(unit)) {
            if (--pendingDependencies[dependent] == 0 && !assigned.get(dependent)) {
                ready.add(dependent);
            }
        }
    }

    public void assignAll(Collection<Integer> units) {
        for (Integer unit : units) {
            assign(unit);
        }
    }

    /**
     * Snapshot of the ready units in ready order.
     */
    public List<Integer> readyUnits() {
        return new ArrayList<>(ready);
    }

    /**
     * Live read-only view of the ready units in ready order. Assigning a unit while iterating it fails.
     */
    public SortedSet<Integer> readyView() {
        return Collections.unmodifiableSortedSet(ready);
    }

    public boolean hasReadyUnits() {
        return !ready.isEmpty();
    }

    public int assignedCount() {
        return assignedCount;
    }

    public boolean isComplete() {
        return assignedCount == unitCount;
    }

    public List<Integer> unassignedUnits() {
        List<Integer> remaining = new ArrayList<>(unitCount - assignedCount);
        for (int unit = assigned.nextClearBit(0); unit < unitCount; unit = assigned.nextClearBit(unit + 1)) {
            remaining.add(unit);
        }
        return remaining;
    }
}
