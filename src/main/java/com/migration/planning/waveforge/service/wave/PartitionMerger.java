package com.migration.planning.waveforge.service.wave;

import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Folds undersized waves into an adjacent wave of the same type.
 *
 * Backward merges (into the preceding wave) are tried first across the whole list; a forward merge
 * (absorbing the following wave) is only tried when no backward merge is possible anywhere. Each merge
 * is checked before it is applied: combined size within max-size and every dependency still resolved
 * by the merged wave or an earlier one. Simple-object waves are never touched. Repeats until nothing
 * changes, then renumbers 1..N.
 *
 * Waves live in fixed slots linked in order, so removing a wave never shifts the others and a slot
 * index doubles as the wave's relative position. A pair of waves that failed a check keeps failing
 * until one of them changes, so each scan resumes next to the last merge instead of at the start.
 */
@Service
@Slf4j
public class PartitionMerger {

    /**
     * @return merged copies of the input waves; the input list and its partitions are left unchanged
     */
    public <T extends Comparable<? super T>> List<WavePartition<T>> merge(List<WavePartition<T>> partitions,
                                                                         DependencyGraph<T> graph,
                                                                         int minSize, int maxSize) {
        if (partitions.isEmpty()) {
            return new ArrayList<>();
        }
        List<WavePartition<T>> sorted = new ArrayList<>(partitions);
        sorted.sort(Comparator.comparingInt(WavePartition::getPartitionNumber));

        Slots<T> slots = new Slots<>(sorted);
        int backwardFrom = slots.next(0);
        int forwardFrom = 0;
        int merges = 0;

        while (true) {
            int merged = mergeBackward(slots, graph, backwardFrom, minSize, maxSize);
            if (merged < 0) {
                merged = mergeForward(slots, graph, forwardFrom, minSize, maxSize);
                if (merged < 0) {
                    break;
                }
                forwardFrom = slots.prevOrSelf(merged);
            } else {
                forwardFrom = Math.min(forwardFrom, slots.prevOrSelf(merged));
            }
            merges++;
            backwardFrom = merged;
        }

        List<WavePartition<T>> result = slots.alive();
        for (int i = 0; i < result.size(); i++) {
            result.get(i).setPartitionNumber(i + 1);
        }
        log.info("Merged small partitions: {} -> {} waves ({} merges)", sorted.size(), result.size(), merges);
        return result;
    }

    /**
     * Scan pairs (previous, current) starting with {@code from} as current.
     *
     * @return slot of the wave that absorbed a smaller one, or -1 when no backward merge is possible
     */
    private <T extends Comparable<? super T>> int mergeBackward(Slots<T> slots, DependencyGraph<T> graph, int from,
                                                               int minSize, int maxSize) {
        for (int current = from; current >= 0; current = slots.next(current)) {
            int target = slots.prev(current);
            if (target < 0 || !isMergeCandidate(slots.get(current), slots.get(target), minSize, maxSize)) {
                continue;
            }
            if (!dependenciesResolve(slots, graph, slots.get(current).getNodes(), target, current, target)) {
                continue;
            }
            log.debug("Merging partition {} ({} objects) into preceding partition {} ({} objects)",
                    slots.get(current).getPartitionNumber(), slots.get(current).getSize(),
                    slots.get(target).getPartitionNumber(), slots.get(target).getSize());
            slots.absorb(target, current);
            return target;
        }
        return -1;
    }

    /**
     * Scan pairs (current, following) starting with {@code from} as current.
     *
     * @return slot of the wave that absorbed its follower, or -1 when no forward merge is possible
     */
    private <T extends Comparable<? super T>> int mergeForward(Slots<T> slots, DependencyGraph<T> graph, int from,
                                                              int minSize, int maxSize) {
        for (int current = from; current >= 0; current = slots.next(current)) {
            int following = slots.next(current);
            if (following < 0 || !isMergeCandidate(slots.get(current), slots.get(following), minSize, maxSize)) {
                continue;
            }
            List<T> moving = new ArrayList<>(slots.get(current).getNodes());
            moving.addAll(slots.get(following).getNodes());
            if (!dependenciesResolve(slots, graph, moving, current, current, following)) {
                continue;
            }
            log.debug("Merging following partition {} ({} objects) into partition {} ({} objects)",
                    slots.get(following).getPartitionNumber(), slots.get(following).getSize(),
                    slots.get(current).getPartitionNumber(), slots.get(current).getSize());
            slots.absorb(current, following);
            return current;
        }
        return -1;
    }

    private <T> boolean isMergeCandidate(WavePartition<T> small, WavePartition<T> neighbor, int minSize, int maxSize) {
        if (small.isSimpleObjectWave() || neighbor.isSimpleObjectWave()) {
            return false;
        }
        if (small.getSize() >= minSize) {
            return false;
        }
        if (small.getPartitionType() != neighbor.getPartitionType()) {
            return false;
        }
        return small.getSize() + neighbor.getSize() <= maxSize;
    }

    /**
     * Every dependency of {@code nodes} must sit in one of the two merging waves or in a wave at or
     * before {@code mergedSlot}, the position the merged wave will occupy.
     */
    private <T extends Comparable<? super T>> boolean dependenciesResolve(Slots<T> slots, DependencyGraph<T> graph,
                                                                         List<T> nodes, int mergedSlot,
                                                                         int first, int second) {
        for (T node : nodes) {
            for (T dependency : graph.getDirectDependencies(node)) {
                Integer owner = slots.ownerOf(dependency);
                if (owner != null && owner > mergedSlot && owner != first && owner != second) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Working copies of the waves in their original order, with removal by unlinking.
     */
    private static final class Slots<T> {
        private final List<WavePartition<T>> partitions = new ArrayList<>();
        private final int[] prev;
        private final int[] next;
        private final Map<T, Integer> owner = new HashMap<>();

        Slots(List<WavePartition<T>> ordered) {
            int n = ordered.size();
            prev = new int[n];
            next = new int[n];
            for (int i = 0; i < n; i++) {
                WavePartition<T> copy = ordered.get(i).copy();
                partitions.add(copy);
                prev[i] = i - 1;
                next[i] = i + 1 < n ? i + 1 : -1;
                for (T node : copy.getNodes()) {
                    owner.put(node, i);
                }
            }
        }

        WavePartition<T> get(int slot) {
            return partitions.get(slot);
        }

        int prev(int slot) {
            return prev[slot];
        }

        int next(int slot) {
            return next[slot];
        }

        int prevOrSelf(int slot) {
            return prev[slot] >= 0 ? prev[slot] : slot;
        }

        Integer ownerOf(T node) {
            return owner.get(node);
        }

        // append `from` to `into` and unlink `from`; the two slots are adjacent
        void absorb(int into, int from) {
            WavePartition<T> target = partitions.get(into);
            WavePartition<T> source = partitions.get(from);
            target.getNodes().addAll(source.getNodes());
            target.getSeedUnitIds().addAll(source.getSeedUnitIds());
            target.getSeedNodes().addAll(source.getSeedNodes());
            for (T node : source.getNodes()) {
                owner.put(node, into);
            }
            int before = prev[from];
            int after = next[from];
            if (before >= 0) {
                next[before] = after;
            }
            if (after >= 0) {
                prev[after] = before;
            }
            partitions.set(from, null);
        }

        List<WavePartition<T>> alive() {
            List<WavePartition<T>> result = new ArrayList<>();
            for (int slot = 0; slot >= 0; slot = next[slot]) {
                result.add(partitions.get(slot));
            }
            return result;
        }
    }
}
