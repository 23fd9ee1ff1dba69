package com.migration.planning.waveforge.service.graph;

import com.migration.planning.waveforge.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Connectivity analysis over a dependency graph: strongly connected components, weakly connected
 * components and cycles.
 *
 * Both traversals are iterative so long dependency chains cannot overflow the call stack.
 * Start nodes are taken in sorted order and results are sorted by minimum member, so the output is
 * identical across runs regardless of hash ordering.
 */
@Service
@Slf4j
public class ConnectivityAnalyzer {

    private enum FrameKind {
        VISIT,
        PROCESS,
        UPDATE_LOWLINK
    }

    /**
     * One entry of the explicit Tarjan work-stack.
     * PROCESS frames carry the neighbor cursor; UPDATE_LOWLINK frames carry the finished child.
     */
    private static final class Frame<T> {
        private FrameKind kind;
        private final T node;
        private Iterator<T> neighbors;
        private final T child;

        private Frame(FrameKind kind, T node, T child) {
            this.kind = kind;
            this.node = node;
            this.child = child;
        }
    }

    /**
     * Tarjan's algorithm driven by an explicit work-stack. O(V+E) time, O(V) space.
     *
     * @return SCCs (each a sorted set) ordered by their minimum member
     */
    public <T extends Comparable<? super T>> List<Set<T>> findStronglyConnectedComponents(DependencyGraph<T> graph) {
        Map<T, Integer> index = new HashMap<>();
        Map<T, Integer> lowlink = new HashMap<>();
        Deque<T> sccStack = new ArrayDeque<>();
        Set<T> onStack = new HashSet<>();
        List<Set<T>> components = new ArrayList<>();
        int counter = 0;

        for (T start : graph.getSortedNodes()) {
            if (index.containsKey(start)) {
                continue;
            }

            Deque<Frame<T>> work = new ArrayDeque<>();
            work.push(new Frame<>(FrameKind.VISIT, start, null));

            while (!work.isEmpty()) {
                Frame<T> frame = work.peek();
                switch (frame.kind) {
                    case VISIT -> {
                        index.put(frame.node, counter);
                        lowlink.put(frame.node, counter);
                        counter++;
                        sccStack.push(frame.node);
                        onStack.add(frame.node);
                        frame.kind = FrameKind.PROCESS;
                        frame.neighbors = graph.getDirectDependencies(frame.node).iterator();
                    }
                    case PROCESS -> {
                        T node = frame.node;
                        if (frame.neighbors.hasNext()) {
                            T neighbor = frame.neighbors.next();
                            if (!index.containsKey(neighbor)) {
                                // runs after the neighbor's subtree completes
                                work.push(new Frame<>(FrameKind.UPDATE_LOWLINK, node, neighbor));
                                work.push(new Frame<>(FrameKind.VISIT, neighbor, null));
                            } else if (onStack.contains(neighbor)) {
                                lowlink.put(node, Math.min(lowlink.get(node), index.get(neighbor)));
                            }
                        } else {
                            work.pop();
                            if (lowlink.get(node).equals(index.get(node))) {
                                Set<T> component = new TreeSet<>();
                                T member;
                                do {
                                    member = sccStack.pop();
                                    onStack.remove(member);
                                    component.add(member);
                                } while (!member.equals(node));
                                components.add(component);
                            }
                        }
                    }
                    case UPDATE_LOWLINK -> {
                        work.pop();
                        lowlink.put(frame.node, Math.min(lowlink.get(frame.node), lowlink.get(frame.child)));
                    }
                }
            }
        }

        components.sort(byMinimumMember());
        log.debug("Found {} strongly connected components over {} nodes", components.size(), graph.nodeCount());
        return components;
    }

    /**
     * Components of the graph with edge direction ignored, via iterative DFS.
     *
     * @return components (each a sorted set) ordered by their minimum member
     */
    public <T extends Comparable<? super T>> List<Set<T>> findWeaklyConnectedComponents(DependencyGraph<T> graph) {
        Set<T> visited = new HashSet<>();
        List<Set<T>> components = new ArrayList<>();

        for (T start : graph.getSortedNodes()) {
            if (visited.contains(start)) {
                continue;
            }
            Set<T> component = new TreeSet<>();
            Deque<T> stack = new ArrayDeque<>();
            stack.push(start);

            while (!stack.isEmpty()) {
                T node = stack.pop();
                if (!visited.add(node)) {
                    continue;
                }
                component.add(node);
                for (T neighbor : graph.getDirectDependencies(node)) {
                    if (!visited.contains(neighbor)) {
                        stack.push(neighbor);
                    }
                }
                for (T neighbor : graph.getDirectDependents(node)) {
                    if (!visited.contains(neighbor)) {
                        stack.push(neighbor);
                    }
                }
            }
            components.add(component);
        }

        components.sort(byMinimumMember());
        return components;
    }

    /**
     * Circular dependencies: SCCs with more than one member.
     */
    public <T extends Comparable<? super T>> List<Set<T>> findCycles(DependencyGraph<T> graph) {
        return findCycles(findStronglyConnectedComponents(graph));
    }

    public <T extends Comparable<? super T>> List<Set<T>> findCycles(List<Set<T>> stronglyConnectedComponents) {
        List<Set<T>> cycles = new ArrayList<>();
        for (Set<T> component : stronglyConnectedComponents) {
            if (component.size() > 1) {
                cycles.add(component);
            }
        }
        return cycles;
    }

    // components are TreeSets, so the first element is the minimum
    private static <T extends Comparable<? super T>> Comparator<Set<T>> byMinimumMember() {
        return (a, b) -> a.iterator().next().compareTo(b.iterator().next());
    }
}
