package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.PartitionDependency;
import com.migration.planning.waveforge.dto.wave.PlanViolation;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.CondensationGraph;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Checks a set of waves against the deployment invariants: no object depends on a later wave,
 * cycles stay together, and every graph node appears in exactly one wave.
 */
@Service
@Slf4j
public class PartitionValidator {

    public <T extends Comparable<? super T>> List<PlanViolation> validate(DependencyGraph<T> graph,
                                                                         CondensationGraph<T> condensation,
                                                                         List<WavePartition<T>> partitions) {
        List<PlanViolation> violations = new ArrayList<>();
        Map<T, Integer> partitionOf = new HashMap<>();

        for (WavePartition<T> partition : partitions) {
            for (T node : partition.getNodes()) {
                Integer previous = partitionOf.putIfAbsent(node, partition.getPartitionNumber());
                if (previous != null) {
                    violations.add(violation(PlanViolation.Kind.DUPLICATE_NODE,
                            "Object " + node + " appears in partitions " + previous + " and "
                                    + partition.getPartitionNumber(), List.of(node)));
                }
                if (!graph.containsNode(node)) {
                    violations.add(violation(PlanViolation.Kind.UNKNOWN_NODE,
                            "Partition " + partition.getPartitionNumber() + " contains unknown object " + node,
                            List.of(node)));
                }
            }
        }

        for (T node : graph.getSortedNodes()) {
            Integer own = partitionOf.get(node);
            if (own == null) {
                violations.add(violation(PlanViolation.Kind.MISSING_NODE,
                        "Object " + node + " is not assigned to any partition", List.of(node)));
                continue;
            }
            List<T> dependencies = new ArrayList<>(graph.getDirectDependencies(node));
            Collections.sort(dependencies);
            for (T dependency : dependencies) {
                Integer target = partitionOf.get(dependency);
                if (target != null && target > own) {
                    violations.add(violation(PlanViolation.Kind.FORWARD_DEPENDENCY,
                            "Object " + node + " in partition " + own + " depends on " + dependency
                                    + " in later partition " + target, List.of(node, dependency)));
                }
            }
        }

        for (int unit = 0; unit < condensation.unitCount(); unit++) {
            if (!condensation.isCycle(unit)) {
                continue;
            }
            Set<Integer> spread = new TreeSet<>();
            for (T member : condensation.members(unit)) {
                Integer own = partitionOf.get(member);
                if (own != null) {
                    spread.add(own);
                }
            }
            if (spread.size() > 1) {
                violations.add(violation(PlanViolation.Kind.SPLIT_CYCLE,
                        "Cycle " + condensation.members(unit) + " is split across partitions " + spread,
                        condensation.members(unit)));
            }
        }

        if (violations.isEmpty()) {
            log.info("All {} partitions only depend on earlier partitions", partitions.size());
        } else {
            log.warn("Found {} plan violations", violations.size());
            for (PlanViolation v : violations) {
                log.warn("  {}: {}", v.getKind(), v.getMessage());
            }
        }
        return violations;
    }

    /**
     * Every matrix cell must point from a later partition to a strictly earlier one.
     */
    public List<PlanViolation> validateMatrix(List<PartitionDependency> matrix) {
        List<PlanViolation> violations = new ArrayList<>();
        for (PartitionDependency cell : matrix) {
            if (cell.getTargetPartition() >= cell.getSourcePartition()) {
                violations.add(violation(PlanViolation.Kind.FORWARD_DEPENDENCY,
                        "Partition " + cell.getSourcePartition() + " depends on later/same partition "
                                + cell.getTargetPartition() + " (" + cell.getDependencyCount() + " edges)",
                        List.of()));
            }
        }
        return violations;
    }

    private static <T> PlanViolation violation(PlanViolation.Kind kind, String message, List<T> nodes) {
        List<String> names = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            names.add(String.valueOf(node));
        }
        return PlanViolation.builder().kind(kind).message(message).nodes(names).build();
    }
}
