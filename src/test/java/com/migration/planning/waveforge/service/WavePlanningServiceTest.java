package com.migration.planning.waveforge.service;

import com.migration.planning.waveforge.config.WavePlanningOptions;
import com.migration.planning.waveforge.dto.graph.DependencyEdge;
import com.migration.planning.waveforge.dto.graph.NodeInfo;
import com.migration.planning.waveforge.dto.wave.DeploymentPlan;
import com.migration.planning.waveforge.dto.wave.PartitionType;
import com.migration.planning.waveforge.dto.wave.SccPriority;
import com.migration.planning.waveforge.dto.wave.WavePartition;
import com.migration.planning.waveforge.exception.MalformedPatternException;
import com.migration.planning.waveforge.model.graph.DependencyGraph;
import com.migration.planning.waveforge.service.graph.CondensationBuilder;
import com.migration.planning.waveforge.service.graph.ConnectivityAnalyzer;
import com.migration.planning.waveforge.service.graph.GraphStructureAnalyzer;
import com.migration.planning.waveforge.service.wave.PartitionAnalyzer;
import com.migration.planning.waveforge.service.wave.PartitionMerger;
import com.migration.planning.waveforge.service.wave.PartitionValidator;
import com.migration.planning.waveforge.service.wave.WavePartitioner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavePlanningServiceTest {

    private static final List<String> CATEGORIES = List.of("TABLE", "VIEW", "FUNCTION", "PROCEDURE", "ETL", "Unknown");

    private final ConnectivityAnalyzer connectivityAnalyzer = new ConnectivityAnalyzer();
    private final CondensationBuilder condensationBuilder = new CondensationBuilder(connectivityAnalyzer);
    private final WavePartitioner wavePartitioner = new WavePartitioner();

    private WavePlanningService planningService;

    @BeforeEach
    void setUp() {
        planningService = new WavePlanningService(
                connectivityAnalyzer,
                condensationBuilder,
                new GraphStructureAnalyzer(connectivityAnalyzer),
                wavePartitioner,
                new PartitionMerger(),
                new PartitionAnalyzer(),
                new PartitionValidator(),
                WavePlanningOptions.defaults());
    }

    @Test
    void chain_collapsesIntoOneWaveInDependencyOrder() {
        DeploymentPlan<String> plan = planningService.plan(
                List.of(DependencyEdge.of("A", "B"), DependencyEdge.of("B", "C")), Map.of());

        assertThat(plan.getPartitions()).hasSize(1);
        assertThat(plan.getPartitions().get(0).getNodes()).containsExactly("C", "B", "A");
        assertThat(plan.getDependencyMatrix()).isEmpty();
        assertThat(plan.isValid()).isTrue();
        assertThat(plan.getGraphSummary().getRootNodes()).isEqualTo(1);
    }

    @Test
    void mutualReference_isReportedAsCycleAndKeptTogether() {
        DeploymentPlan<String> plan = planningService.plan(
                List.of(DependencyEdge.of("A", "B"), DependencyEdge.of("B", "A"), DependencyEdge.of("C", "A")),
                Map.of(), WavePlanningOptions.builder().minSize(1).maxSize(1).build());

        assertThat(plan.getCycles()).containsExactly(List.of("A", "B"));
        assertThat(plan.partitionOf("A")).isEqualTo(plan.partitionOf("B"));
        assertThat(plan.partitionOf("C")).isGreaterThan(plan.partitionOf("A"));
        assertThat(plan.partitionOf("missing")).isNull();

        SccPriority<String> cycle = plan.getSccPriorities().stream()
                .filter(p -> p.getUnitSize() == 2)
                .findFirst()
                .orElseThrow();
        assertThat(cycle.getAssignedPartition()).isEqualTo(plan.partitionOf("A"));
    }

    @Test
    void nodesWithoutEdges_areStillPlanned() {
        Map<String, NodeInfo> nodeInfo = new HashMap<>();
        nodeInfo.put("T1", NodeInfo.ofCategory("TABLE"));
        nodeInfo.put("P1", NodeInfo.ofCategory("PROCEDURE"));

        DeploymentPlan<String> plan = planningService.plan(List.<DependencyEdge<String>>of(), nodeInfo);

        assertThat(plan.getPartitions()).extracting(WavePartition::getPartitionType)
                .containsExactly(PartitionType.SIMPLE_OBJECT, PartitionType.REGULAR);
        assertThat(plan.partitionAssignments()).containsOnlyKeys("T1", "P1");
    }

    @Test
    void emptyInput_yieldsEmptyPlan() {
        DeploymentPlan<String> plan = planningService.plan(List.<DependencyEdge<String>>of(), Map.of());

        assertThat(plan.getPartitions()).isEmpty();
        assertThat(plan.getDependencyMatrix()).isEmpty();
        assertThat(plan.getGraphSummary().getTotalNodes()).isZero();
        assertThat(plan.isValid()).isTrue();
    }

    @Test
    void randomGraphs_satisfyDeploymentInvariants() {
        WavePlanningOptions options = WavePlanningOptions.builder()
                .minSize(5)
                .maxSize(12)
                .prioritizePatterns(List.of("N00*"))
                .build();

        for (long seed = 1; seed <= 20; seed++) {
            List<DependencyEdge<String>> edges = new ArrayList<>();
            Map<String, NodeInfo> nodeInfo = randomGraph(seed, 300, edges);

            DeploymentPlan<String> plan = planningService.plan(edges, nodeInfo, options);

            assertThat(plan.getViolations()).as("seed %d", seed).isEmpty();
            assertInvariants(plan, edges, nodeInfo.keySet(), options);

            DependencyGraph<String> graph = planningService.buildGraph(edges, nodeInfo);
            int unmerged = wavePartitioner.partition(graph, condensationBuilder.build(graph), options)
                    .partitions().size();
            assertThat(plan.getPartitions().size()).as("seed %d", seed).isLessThanOrEqualTo(unmerged);
        }
    }

    @Test
    void planning_isIndependentOfInputOrder() {
        List<DependencyEdge<String>> edges = new ArrayList<>();
        Map<String, NodeInfo> nodeInfo = randomGraph(42, 200, edges);
        WavePlanningOptions options = WavePlanningOptions.builder().minSize(4).maxSize(9).build();

        DeploymentPlan<String> first = planningService.plan(edges, new TreeMap<>(nodeInfo), options);
        List<DependencyEdge<String>> shuffled = new ArrayList<>(edges);
        Collections.shuffle(shuffled, new Random(7));
        DeploymentPlan<String> second = planningService.plan(shuffled, new HashMap<>(nodeInfo), options);

        assertThat(second.getPartitions()).extracting(WavePartition::getNodes)
                .isEqualTo(first.getPartitions().stream().map(WavePartition::getNodes).toList());
        assertThat(second.getDependencyMatrix()).isEqualTo(first.getDependencyMatrix());
    }

    @Test
    void longChain_isPackedIntoFullWaves() {
        int length = 20_000;
        List<DependencyEdge<String>> edges = new ArrayList<>(length);
        for (int i = 0; i + 1 < length; i++) {
            edges.add(DependencyEdge.of(String.format("N%05d", i + 1), String.format("N%05d", i)));
        }
        WavePlanningOptions options = WavePlanningOptions.builder().transitiveDepthLimit(3).build();

        DeploymentPlan<String> plan = planningService.plan(edges, Map.of(), options);

        assertThat(plan.getPartitions()).hasSize(250);
        assertThat(plan.getPartitions()).allMatch(p -> p.getSize() == 80);
        assertThat(plan.getPartitions().get(0).getNodes().get(0)).isEqualTo("N00000");
        assertThat(plan.getDependencyMatrix()).hasSize(249);
        assertThat(plan.isValid()).isTrue();
    }

    @Test
    void invalidOptions_failBeforeTheGraphIsFrozen() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("A", "B");

        assertThatThrownBy(() -> planningService.plan(graph,
                WavePlanningOptions.builder().minSize(10).maxSize(5).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planningService.plan(graph,
                WavePlanningOptions.builder().prioritizePatterns(List.of("PKG_[A*")).build()))
                .isInstanceOf(MalformedPatternException.class);
        assertThat(graph.isFrozen()).isFalse();
    }

    private static Map<String, NodeInfo> randomGraph(long seed, int size, List<DependencyEdge<String>> edges) {
        Random random = new Random(seed);
        Map<String, NodeInfo> nodeInfo = new HashMap<>();
        for (int i = 0; i < size; i++) {
            String node = String.format("N%03d", i);
            nodeInfo.put(node, NodeInfo.ofCategory(CATEGORIES.get(random.nextInt(CATEGORIES.size()))));
            if (i == 0) {
                continue;
            }
            int dependencies = random.nextInt(4);
            for (int d = 0; d < dependencies; d++) {
                String target = String.format("N%03d", random.nextInt(i));
                edges.add(DependencyEdge.of(node, target));
                if (random.nextInt(25) == 0) {
                    edges.add(DependencyEdge.of(target, node));  // closes a cycle
                }
            }
        }
        return nodeInfo;
    }

    private static void assertInvariants(DeploymentPlan<String> plan, List<DependencyEdge<String>> edges,
                                         Set<String> nodes, WavePlanningOptions options) {
        Map<String, Integer> assignments = plan.partitionAssignments();
        int total = plan.getPartitions().stream().mapToInt(WavePartition::getSize).sum();
        assertThat(total).isEqualTo(nodes.size());
        assertThat(assignments.keySet()).isEqualTo(nodes);

        for (int i = 0; i < plan.getPartitions().size(); i++) {
            assertThat(plan.getPartitions().get(i).getPartitionNumber()).isEqualTo(i + 1);
        }
        for (DependencyEdge<String> edge : edges) {
            assertThat(assignments.get(edge.getCaller()))
                    .as("%s -> %s", edge.getCaller(), edge.getReferenced())
                    .isGreaterThanOrEqualTo(assignments.get(edge.getReferenced()));
        }
        for (List<String> cycle : plan.getCycles()) {
            assertThat(cycle.stream().map(assignments::get).distinct()).hasSize(1);
        }

        // no merge the merger would still accept is left behind
        List<WavePartition<String>> waves = plan.getPartitions();
        for (int i = 0; i + 1 < waves.size(); i++) {
            WavePartition<String> left = waves.get(i);
            WavePartition<String> right = waves.get(i + 1);
            boolean mergeable = !left.isSimpleObjectWave() && !right.isSimpleObjectWave()
                    && left.getPartitionType() == right.getPartitionType()
                    && left.getSize() + right.getSize() <= options.getMaxSize()
                    && (left.getSize() < options.getMinSize() || right.getSize() < options.getMinSize());
            assertThat(mergeable).as("waves %d and %d", i + 1, i + 2).isFalse();
        }
    }
}
