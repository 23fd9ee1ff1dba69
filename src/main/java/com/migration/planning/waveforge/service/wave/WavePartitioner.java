package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.config.WavePlanningOptions;
import com.migration.planning.waveforge.dto.wave.PartitionType;
import com.migration.planning.waveforge.dto.wave.SccPriority;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.exception.GraphInconsistencyException;
import com.migration.planning.waveforge.model.graph.CondensationGraph;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Splits the condensation DAG into ordered deployment waves.
 *
 * Phase 1 (category leveling, optional): waves of "simple" objects (tables, views, functions by default),
 * one uncapped wave per category and dependency level, repeated until a full pass places nothing.
 *
 * Phase 2 (priority bin-packing): remaining units are admitted in priority order and packed
 * greedily between min-size and max-size.
 *
 * Each wave only contains units whose dependencies are in the same or an earlier wave.
 */
@Service
@Slf4j
public class WavePartitioner {

    /**
     * Partitioning output before merging: waves numbered 1..N plus the priority ranking of every unit.
     */
    public record Result<T>(List<WavePartition<T>> partitions, List<SccPriority<T>> sccPriorities) {
    }

    public <T extends Comparable<? super T>> Result<T> partition(DependencyGraph<T> graph,
                                                                 CondensationGraph<T> condensation,
                                                                 WavePlanningOptions options) {
        options.validate();
        PriorityPatternMatcher patterns = PriorityPatternMatcher.compile(options.getPrioritizePatterns());

        if (condensation.unitCount() == 0) {
            log.info("Empty graph, no waves to create");
            return new Result<>(new ArrayList<>(), new ArrayList<>());
        }

        UnitPriorityRanker<T> ranker = new UnitPriorityRanker<>(graph, condensation, patterns,
                options.getEtlCategory(), options.getTransitiveDepthLimit());
        AssignmentState state = new AssignmentState(condensation.getUnitGraph(), condensation.unitCount(),
                ranker.order());
        List<WavePartition<T>> partitions = new ArrayList<>();

        if (options.isCategoryWaves()) {
            partitions.addAll(levelCategories(graph, condensation, options.getSimpleCategories(), state, 1));
            log.info("Category leveling created {} simple-object waves covering {} units",
                    partitions.size(), state.assignedCount());
        }

        partitions.addAll(packByPriority(condensation, ranker, options, state, partitions));

        log.info("Created {} waves for {} units ({} nodes)",
                partitions.size(), condensation.unitCount(), graph.nodeCount());
        return new Result<>(partitions, rankUnits(condensation, ranker));
    }

    /**
     * Phase 1. Places every ready unit whose members are all of simple categories, category by category,
     * until a full pass over the category list places nothing.
     *
     * @param firstPartitionNumber number given to the first wave created here
     */
    <T extends Comparable<? super T>> List<WavePartition<T>> levelCategories(DependencyGraph<T> graph,
                                                                            CondensationGraph<T> condensation,
                                                                            List<String> simpleCategories,
                                                                            AssignmentState state,
                                                                            int firstPartitionNumber) {
        List<WavePartition<T>> waves = new ArrayList<>();
        if (simpleCategories.isEmpty()) {
            return waves;
        }

        // unit -> index of the latest simple category among its members, or absent if not simple
        Map<Integer, Integer> categoryOfUnit = new HashMap<>();
        for (int unit = 0; unit < condensation.unitCount(); unit++) {
            int latest = -1;
            for (T member : condensation.members(unit)) {
                int position = simpleCategories.indexOf(graph.getCategory(member));
                if (position < 0) {
                    latest = -1;
                    break;
                }
                latest = Math.max(latest, position);
            }
            if (latest >= 0) {
                categoryOfUnit.put(unit, latest);
            }
        }
        if (categoryOfUnit.isEmpty()) {
            return waves;
        }

        int partitionNumber = firstPartitionNumber;
        boolean placedInRound = true;
        while (placedInRound) {
            placedInRound = false;
            for (int category = 0; category < simpleCategories.size(); category++) {
                while (true) {
                    List<Integer> ready = new ArrayList<>();
                    for (Integer unit : state.readyUnits()) {
                        if (Integer.valueOf(category).equals(categoryOfUnit.get(unit))) {
                            ready.add(unit);
                        }
                    }
                    if (ready.isEmpty()) {
                        break;
                    }
                    Collections.sort(ready);

                    List<T> nodes = new ArrayList<>();
                    for (Integer unit : ready) {
                        nodes.addAll(condensation.members(unit));
                    }
                    waves.add(WavePartition.<T>builder()
                            .partitionNumber(partitionNumber++)
                            .nodes(nodes)
                            .partitionType(PartitionType.SIMPLE_OBJECT)
                            .seedUnitIds(new ArrayList<>(ready))
                            .seedNodes(new ArrayList<>(nodes))
                            .build());
                    state.assignAll(ready);
                    placedInRound = true;

                    log.debug("Created simple-object wave {} ({}) with {} units, {} objects",
                            partitionNumber - 1, simpleCategories.get(category), ready.size(), nodes.size());
                }
            }
        }
        return waves;
    }

    /**
     * Phase 2. Packs all remaining units into size-bounded waves in priority order.
     *
     * @param earlier waves already created; numbering continues after them and they are reported
     *                as completed work if the unit graph turns out to be cyclic
     * @throws GraphInconsistencyException when units remain but none is ready
     */
    <T extends Comparable<? super T>> List<WavePartition<T>> packByPriority(CondensationGraph<T> condensation,
                                                                           UnitPriorityRanker<T> ranker,
                                                                           WavePlanningOptions options,
                                                                           AssignmentState state,
                                                                           List<WavePartition<T>> earlier) {
        int minSize = options.getMinSize();
        int maxSize = options.getMaxSize();
        List<WavePartition<T>> waves = new ArrayList<>();
        int partitionNumber = earlier.size() + 1;

        while (!state.isComplete()) {
            if (!state.hasReadyUnits()) {
                List<Integer> stuck = state.unassignedUnits();
                log.error("No ready units found but {} unassigned units remain; condensation graph is not acyclic",
                        stuck.size());
                List<WavePartition<T>> completed = new ArrayList<>(earlier);
                completed.addAll(waves);
                throw new GraphInconsistencyException(stuck, completed);
            }

            // skipped units never fit later since the wave only grows, so one pass also covers the top-up
            SortedSet<Integer> ready = state.readyView();
            List<Integer> waveUnits = new ArrayList<>();
            int waveSize = 0;
            for (Integer unit : ready) {
                int unitSize = condensation.size(unit);
                if (waveSize > 0 && waveSize + unitSize > maxSize) {
                    continue;
                }
                waveUnits.add(unit);
                waveSize += unitSize;
                if (waveSize >= minSize) {
                    break;
                }
            }

            Integer seed = waveUnits.get(0);
            List<T> nodes = new ArrayList<>(waveSize);
            for (Integer unit : orderWithinWave(condensation, new HashSet<>(waveUnits))) {
                nodes.addAll(condensation.members(unit));
            }
            PartitionType type = ranker.isUserPrioritized(seed) ? PartitionType.USER_PRIORITIZED : PartitionType.REGULAR;

            log.debug("Creating partition {} with {} units, {} objects (seed unit {}, {})",
                    partitionNumber, waveUnits.size(), nodes.size(), seed, type.getValue());

            waves.add(WavePartition.<T>builder()
                    .partitionNumber(partitionNumber++)
                    .nodes(nodes)
                    .partitionType(type)
                    .seedUnitIds(new ArrayList<>(List.of(seed)))
                    .seedNodes(new ArrayList<>(condensation.members(seed)))
                    .build());
            state.assignAll(waveUnits);
        }
        return waves;
    }

    /**
     * Kahn's algorithm restricted to the wave's units; ties go to the smaller unit, then the smaller minimum member.
     */
    <T extends Comparable<? super T>> List<Integer> orderWithinWave(CondensationGraph<T> condensation,
                                                                   Set<Integer> waveUnits) {
        DependencyGraph<Integer> unitGraph = condensation.getUnitGraph();
        Map<Integer, Integer> inDegree = new HashMap<>();
        for (Integer unit : waveUnits) {
            int local = 0;
            for (Integer dependency : unitGraph.getDirectDependencies(unit)) {
                if (waveUnits.contains(dependency)) {
                    local++;
                }
            }
            inDegree.put(unit, local);
        }

        Comparator<Integer> tieBreak = Comparator.<Integer>comparingInt(condensation::size)
                .thenComparing(condensation::minMember);
        PriorityQueue<Integer> queue = new PriorityQueue<>(tieBreak);
        for (Map.Entry<Integer, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.add(entry.getKey());
            }
        }

        List<Integer> ordered = new ArrayList<>(waveUnits.size());
        while (!queue.isEmpty()) {
            Integer current = queue.poll();
            ordered.add(current);
            for (Integer dependent : unitGraph.getDirectDependents(current)) {
                Integer remaining = inDegree.get(dependent);
                if (remaining != null) {
                    inDegree.put(dependent, remaining - 1);
                    if (remaining - 1 == 0) {
                        queue.add(dependent);
                    }
                }
            }
        }
        return ordered;
    }

    /**
     * Every unit with its priority key, sorted in admission order. Assigned partitions are filled in
     * once the final numbering is known.
     */
    private <T extends Comparable<? super T>> List<SccPriority<T>> rankUnits(CondensationGraph<T> condensation,
                                                                            UnitPriorityRanker<T> ranker) {
        List<Integer> units = new ArrayList<>(condensation.unitCount());
        for (int unit = 0; unit < condensation.unitCount(); unit++) {
            units.add(unit);
        }
        ranker.sort(units);

        List<SccPriority<T>> ranking = new ArrayList<>(units.size());
        for (Integer unit : units) {
            UnitPriority<T> priority = ranker.priorityOf(unit);
            ranking.add(SccPriority.<T>builder()
                    .unitId(unit)
                    .unitSize(priority.size())
                    .nodes(new ArrayList<>(condensation.members(unit)))
                    .priorityTier(priority.tier())
                    .totalDependents(priority.totalDependents())
                    .transitiveDependencies(priority.transitiveDependencies())
                    .minNode(priority.minMember())
                    .userPrioritized(priority.userPrioritized())
                    .build());
        }
        return ranking;
    }
}
