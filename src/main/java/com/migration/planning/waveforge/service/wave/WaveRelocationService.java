package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.RelocationRequest;
import com.migration.planning.waveforge.dto.wave.RelocationResult;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Moves objects to a requested wave while keeping the rest of the plan where it is.
 *
 * Moving an object earlier pulls every dependency that sits in a later wave along with it; moving it
 * later pushes every dependent that sits in an earlier wave. Emptied waves are then compacted away.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WaveRelocationService {

    private final PartitionAnalyzer partitionAnalyzer;

    public <T extends Comparable<? super T>> RelocationResult<T> relocate(DependencyGraph<T> graph,
                                                                         List<WavePartition<T>> partitions,
                                                                         List<RelocationRequest<T>> requests) {
        Map<T, Integer> original = new HashMap<>();
        Map<T, Integer> positionInWave = new HashMap<>();
        TreeMap<Integer, WavePartition<T>> byNumber = new TreeMap<>();
        for (WavePartition<T> partition : partitions) {
            byNumber.put(partition.getPartitionNumber(), partition);
            List<T> nodes = partition.getNodes();
            for (int i = 0; i < nodes.size(); i++) {
                original.put(nodes.get(i), partition.getPartitionNumber());
                positionInWave.put(nodes.get(i), i);
            }
        }

        Map<T, Integer> assignments = new HashMap<>(original);
        for (RelocationRequest<T> request : requests) {
            T node = request.getNode();
            if (!assignments.containsKey(node)) {
                throw new IllegalArgumentException("Object not found in any wave: " + node);
            }
            if (request.getTargetWave() < 1) {
                throw new IllegalArgumentException("Target wave must be positive, got " + request.getTargetWave()
                        + " for " + node);
            }
            int current = assignments.get(node);
            if (request.getTargetWave() < current) {
                moveEarlier(graph, node, request.getTargetWave(), assignments);
            } else if (request.getTargetWave() > current) {
                moveLater(graph, node, request.getTargetWave(), assignments);
            }
        }

        // compact: wave numbers still in use become 1..N, keeping their relative order
        List<Integer> used = new ArrayList<>(new TreeSet<>(assignments.values()));
        Map<Integer, Integer> renumber = new HashMap<>();
        for (int i = 0; i < used.size(); i++) {
            renumber.put(used.get(i), i + 1);
        }
        Map<T, Integer> compacted = new HashMap<>();
        assignments.forEach((node, wave) -> compacted.put(node, renumber.get(wave)));

        List<WavePartition<T>> rebuilt = rebuild(used, assignments, original, positionInWave, byNumber);
        partitionAnalyzer.analyze(rebuilt, graph);

        List<T> moved = new ArrayList<>();
        for (Map.Entry<T, Integer> entry : assignments.entrySet()) {
            if (!entry.getValue().equals(original.get(entry.getKey()))) {
                moved.add(entry.getKey());
            }
        }
        Collections.sort(moved);

        log.info("Relocated {} objects for {} requests; {} waves after compaction",
                moved.size(), requests.size(), rebuilt.size());
        return RelocationResult.<T>builder()
                .partitions(rebuilt)
                .waveAssignments(compacted)
                .movedNodes(moved)
                .build();
    }

    private <T extends Comparable<? super T>> void moveEarlier(DependencyGraph<T> graph, T start, int targetWave,
                                                              Map<T, Integer> assignments) {
        Deque<T> queue = new ArrayDeque<>();
        Deque<Integer> limits = new ArrayDeque<>();
        queue.add(start);
        limits.add(targetWave);

        // waves only move in one direction, so a node is re-queued only when its bound tightens
        while (!queue.isEmpty()) {
            T node = queue.poll();
            int maxWave = limits.poll();
            Integer wave = assignments.get(node);
            if (wave == null) {
                continue;
            }
            if (wave > maxWave) {
                assignments.put(node, maxWave);
            }
            int finalWave = assignments.get(node);
            for (T dependency : graph.getDirectDependencies(node)) {
                Integer dependencyWave = assignments.get(dependency);
                if (dependencyWave != null && dependencyWave > finalWave) {
                    queue.add(dependency);
                    limits.add(finalWave);
                }
            }
        }
    }

    private <T extends Comparable<? super T>> void moveLater(DependencyGraph<T> graph, T start, int targetWave,
                                                            Map<T, Integer> assignments) {
        Deque<T> queue = new ArrayDeque<>();
        Deque<Integer> limits = new ArrayDeque<>();
        queue.add(start);
        limits.add(targetWave);

        // waves only move in one direction, so a node is re-queued only when its bound tightens
        while (!queue.isEmpty()) {
            T node = queue.poll();
            int minWave = limits.poll();
            Integer wave = assignments.get(node);
            if (wave == null) {
                continue;
            }
            if (wave < minWave) {
                assignments.put(node, minWave);
            }
            int finalWave = assignments.get(node);
            for (T dependent : graph.getDirectDependents(node)) {
                Integer dependentWave = assignments.get(dependent);
                if (dependentWave != null && dependentWave < finalWave) {
                    queue.add(dependent);
                    limits.add(finalWave);
                }
            }
        }
    }

    /**
     * Group nodes by their new wave. Within a wave nodes keep the order (original wave, original position);
     * the wave keeps the type of the original wave with the same number, falling back to the closest
     * earlier original wave when that number is missing (past the end, or a gap in the input numbering),
     * and to the first original wave when there is no earlier one.
     */
    private <T extends Comparable<? super T>> List<WavePartition<T>> rebuild(List<Integer> usedWaves,
                                                                            Map<T, Integer> assignments,
                                                                            Map<T, Integer> original,
                                                                            Map<T, Integer> positionInWave,
                                                                            TreeMap<Integer, WavePartition<T>> byNumber) {
        Map<Integer, List<T>> members = new TreeMap<>();
        assignments.forEach((node, wave) -> members.computeIfAbsent(wave, k -> new ArrayList<>()).add(node));

        Comparator<T> originalOrder = Comparator.<T>comparingInt(original::get)
                .thenComparingInt(positionInWave::get)
                .thenComparing(Comparator.naturalOrder());

        List<WavePartition<T>> rebuilt = new ArrayList<>(usedWaves.size());
        for (int i = 0; i < usedWaves.size(); i++) {
            int wave = usedWaves.get(i);
            List<T> nodes = members.get(wave);
            nodes.sort(originalOrder);

            Map.Entry<Integer, WavePartition<T>> floor = byNumber.floorEntry(wave);
            WavePartition<T> template = floor != null ? floor.getValue() : byNumber.firstEntry().getValue();
            rebuilt.add(WavePartition.<T>builder()
                    .partitionNumber(i + 1)
                    .nodes(nodes)
                    .partitionType(template.getPartitionType())
                    .seedUnitIds(new ArrayList<>(template.getSeedUnitIds()))
                    .seedNodes(new ArrayList<>(template.getSeedNodes()))
                    .build());
        }
        return rebuilt;
    }
}
