package com.migration.planning.waveforge.service.graph;

import com.migration.planning.waveforge.model.graph.DependencyGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectivityAnalyzerTest {

    private final ConnectivityAnalyzer analyzer = new ConnectivityAnalyzer();

    @Test
    void chain_hasOnlySingletonComponents() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("A", "B");
        graph.addEdge("B", "C");

        List<Set<String>> sccs = analyzer.findStronglyConnectedComponents(graph);

        assertThat(sccs).containsExactly(Set.of("A"), Set.of("B"), Set.of("C"));
        assertThat(analyzer.findCycles(graph)).isEmpty();
    }

    @Test
    void mutualReference_formsOneCycle() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("A", "B");
        graph.addEdge("B", "A");

        assertThat(analyzer.findStronglyConnectedComponents(graph)).containsExactly(Set.of("A", "B"));
        assertThat(analyzer.findCycles(graph)).containsExactly(Set.of("A", "B"));
    }

    @Test
    void components_areSortedByMinimumMember() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("Z", "Y");
        graph.addEdge("Y", "Z");
        graph.addEdge("M", "B");
        graph.addEdge("B", "M");
        graph.addEdge("M", "Z");
        graph.addNode("A");

        List<Set<String>> sccs = analyzer.findStronglyConnectedComponents(graph);

        assertThat(sccs).containsExactly(Set.of("A"), Set.of("B", "M"), Set.of("Y", "Z"));
        assertThat(sccs.get(1)).containsExactly("B", "M");
    }

    @Test
    void nestedCycles_collapseIntoOneComponent() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("A", "B");
        graph.addEdge("B", "C");
        graph.addEdge("C", "A");
        graph.addEdge("C", "D");
        graph.addEdge("D", "B");
        graph.addEdge("D", "E");

        assertThat(analyzer.findStronglyConnectedComponents(graph))
                .containsExactly(Set.of("A", "B", "C", "D"), Set.of("E"));
    }

    @Test
    void longChain_doesNotOverflowTheStack() {
        DependencyGraph<Integer> graph = new DependencyGraph<>();
        int length = 200_000;
        for (int i = 1; i < length; i++) {
            graph.addEdge(i, i - 1);
        }
        graph.addEdge(0, length - 1);  // close the loop

        List<Set<Integer>> sccs = analyzer.findStronglyConnectedComponents(graph);

        assertThat(sccs).hasSize(1);
        assertThat(sccs.get(0)).hasSize(length);
    }

    @Test
    void weakComponents_ignoreDirection() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("A", "C");
        graph.addEdge("B", "C");
        graph.addEdge("X", "Y");
        graph.addNode("Q");

        assertThat(analyzer.findWeaklyConnectedComponents(graph))
                .containsExactly(Set.of("A", "B", "C"), Set.of("Q"), Set.of("X", "Y"));
    }

    @Test
    void emptyGraph_yieldsEmptyResults() {
        DependencyGraph<String> graph = new DependencyGraph<>();

        assertThat(analyzer.findStronglyConnectedComponents(graph)).isEmpty();
        assertThat(analyzer.findWeaklyConnectedComponents(graph)).isEmpty();
        assertThat(analyzer.findCycles(graph)).isEmpty();
    }
}
