package com.migration.planning.waveforge.model.graph;

import com.migration.planning.waveforge.dto.graph.NodeInfo;

import java.util.*;

/**
 * Directed dependency graph between migration objects.
 *
 * An edge {@code caller -> referenced} means the caller depends on the referenced object.
 * Keeps forward adjacency (dependencies), reverse adjacency (dependents) and per-node metadata.
 * Self-edges are dropped and duplicate edges collapse.
 *
 * The graph is built once and then frozen; all analysis runs against the frozen structure.
 *
 * @param <T> node identifier, totally ordered so every traversal can be made deterministic
 */
public class DependencyGraph<T extends Comparable<? super T>> {

    private final Map<T, Set<T>> dependencies = new HashMap<>();
    private final Map<T, Set<T>> dependents = new HashMap<>();
    private final Set<T> nodes = new HashSet<>();
    private final Map<T, NodeInfo> nodeInfo = new HashMap<>();
    private int edgeCount;
    private boolean frozen;

    public void addEdge(T caller, T referenced) {
        checkMutable();
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(referenced, "referenced");
        nodes.add(caller);
        nodes.add(referenced);
        if (caller.equals(referenced)) {
            return;
        }
        if (dependencies.computeIfAbsent(caller, k -> new HashSet<>()).add(referenced)) {
            dependents.computeIfAbsent(referenced, k -> new HashSet<>()).add(caller);
            edgeCount++;
        }
    }

    /**
     * Register a node that may have no edges at all.
     */
    public void addNode(T node) {
        checkMutable();
        nodes.add(Objects.requireNonNull(node, "node"));
    }

    /**
     * Attach (or overwrite) metadata for a node. Does not register the node.
     */
    public void addNodeInfo(T node, NodeInfo info) {
        checkMutable();
        nodeInfo.put(Objects.requireNonNull(node, "node"), info);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Set<T> getDirectDependencies(T node) {
        Set<T> deps = dependencies.get(node);
        return deps == null ? Collections.emptySet() : Collections.unmodifiableSet(deps);
    }

    public Set<T> getDirectDependents(T node) {
        Set<T> deps = dependents.get(node);
        return deps == null ? Collections.emptySet() : Collections.unmodifiableSet(deps);
    }

    public Set<T> getTransitiveDependencies(T node) {
        return getTransitiveDependencies(node, null);
    }

    /**
     * All nodes reachable by following dependency edges, excluding the start node.
     *
     * @param maxDepth optional hop limit, {@code null} for an unbounded search
     */
    public Set<T> getTransitiveDependencies(T node, Integer maxDepth) {
        return breadthFirst(node, maxDepth, dependencies);
    }

    public Set<T> getTransitiveDependents(T node) {
        return getTransitiveDependents(node, null);
    }

    /**
     * All nodes that reach the given node, excluding the node itself.
     *
     * @param maxDepth optional hop limit, {@code null} for an unbounded search
     */
    public Set<T> getTransitiveDependents(T node, Integer maxDepth) {
        return breadthFirst(node, maxDepth, dependents);
    }

    /**
     * Nodes nothing depends on, in sorted order.
     */
    public List<T> getRoots() {
        List<T> roots = new ArrayList<>();
        for (T node : nodes) {
            if (getDirectDependents(node).isEmpty()) {
                roots.add(node);
            }
        }
        Collections.sort(roots);
        return roots;
    }

    /**
     * Nodes that depend on nothing, in sorted order.
     */
    public List<T> getLeaves() {
        List<T> leaves = new ArrayList<>();
        for (T node : nodes) {
            if (getDirectDependencies(node).isEmpty()) {
                leaves.add(node);
            }
        }
        Collections.sort(leaves);
        return leaves;
    }

    public Set<T> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public List<T> getSortedNodes() {
        List<T> sorted = new ArrayList<>(nodes);
        Collections.sort(sorted);
        return sorted;
    }

    public boolean containsNode(T node) {
        return nodes.contains(node);
    }

    public Optional<NodeInfo> getNodeInfo(T node) {
        return Optional.ofNullable(nodeInfo.get(node));
    }

    /**
     * Category of the node, or {@link NodeInfo#UNKNOWN_CATEGORY} when it carries no metadata.
     */
    public String getCategory(T node) {
        NodeInfo info = nodeInfo.get(node);
        if (info == null || info.getCategory() == null) {
            return NodeInfo.UNKNOWN_CATEGORY;
        }
        return info.getCategory();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private Set<T> breadthFirst(T start, Integer maxDepth, Map<T, Set<T>> adjacency) {
        Set<T> visited = new HashSet<>();
        visited.add(start);
        Deque<T> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        queue.add(start);
        depths.add(0);

        while (!queue.isEmpty()) {
            T current = queue.poll();
            int depth = depths.poll();
            if (maxDepth != null && depth >= maxDepth) {
                continue;
            }
            for (T neighbor : adjacency.getOrDefault(current, Collections.emptySet())) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                    depths.add(depth + 1);
                }
            }
        }

        visited.remove(start);
        return visited;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Dependency graph is frozen; it can no longer be modified");
        }
    }
}
