package no.cantara.siren.graph;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DirectedGraphTest {

    @Test
    void keepsInsertionOrderAndIgnoresRepeatedEdges() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("b", "c");
        graph.addEdge("a", "c");
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.addNode("b");

        assertEquals(List.of("b", "c", "a"), graph.nodes());
        assertEquals(List.of("c", "b"), graph.successors("a"));
        assertTrue(graph.successors("missing").isEmpty());
    }

    @Test
    void findsEveryDistinctCycle() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");
        graph.addEdge("a", "c");

        List<List<String>> cycles = graph.cycles();
        assertEquals(2, cycles.size());
        assertEquals(Set.of(List.of("a", "b", "c", "a"), List.of("a", "c", "a")), new HashSet<>(cycles));
    }

    @Test
    void selfLoopIsACycle() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("self", "self");

        assertEquals(List.of(List.of("self", "self")), graph.cycles());
    }

    @Test
    void cyclesAreRotatedToSmallestNode() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("z", "m");
        graph.addEdge("m", "b");
        graph.addEdge("b", "z");

        assertEquals(List.of(List.of("b", "z", "m", "b")), graph.cycles());
    }

    @Test
    void acyclicGraphHasNoCycles() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.addEdge("b", "d");
        graph.addEdge("c", "d");

        assertTrue(graph.cycles().isEmpty());
    }

    @Test
    void cyclesKeepDiscoveryOrderAcrossComponents() {
        DirectedGraph graph = new DirectedGraph();
        graph.addNode("p");
        graph.addNode("q1");
        graph.addEdge("q1", "q2");
        graph.addEdge("q2", "q1");
        graph.addEdge("p", "r1");
        graph.addEdge("r1", "r2");
        graph.addEdge("r2", "r1");

        assertEquals(List.of(List.of("r1", "r2", "r1"), List.of("q1", "q2", "q1")), graph.cycles());
    }

    @Test
    void layeredDiamondsDoNotExplodeCycleSearch() {
        DirectedGraph graph = new DirectedGraph();
        int layers = 60;
        for (int layer = 0; layer < layers; layer++) {
            for (String from : List.of("l" + layer + "a", "l" + layer + "b")) {
                graph.addEdge(from, "l" + (layer + 1) + "a");
                graph.addEdge(from, "l" + (layer + 1) + "b");
            }
        }
        graph.addEdge("l" + layers + "a", "z1");
        graph.addEdge("z1", "z2");
        graph.addEdge("z2", "z1");

        List<List<String>> cycles = assertTimeoutPreemptively(Duration.ofSeconds(10), graph::cycles);

        assertEquals(List.of(List.of("z1", "z2", "z1")), cycles);
    }

    @Test
    void componentsGroupNodesOnACycle() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "b");
        graph.addEdge("c", "d");

        Map<String, Integer> components = graph.components();

        assertEquals(components.get("b"), components.get("c"));
        assertNotEquals(components.get("a"), components.get("b"));
        assertNotEquals(components.get("d"), components.get("b"));
        assertEquals(3, new HashSet<>(components.values()).size());
    }

    // -----------------------------------------------------------------------
    // dfs
    // -----------------------------------------------------------------------

    @Test
    void visitsSharedDependencyOncePerPath() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.addEdge("b", "d");
        graph.addEdge("c", "d");

        List<List<String>> pathsToD = new ArrayList<>();
        graph.dfs("a", (id, path, depth) -> {
            if (id.equals("d")) {
                pathsToD.add(path);
                assertEquals(2, depth);
            }
            return true;
        }, null);

        assertEquals(List.of(List.of("a", "b", "d"), List.of("a", "c", "d")), pathsToD);
    }

    @Test
    void visitorCanStopExpansion() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");

        List<String> visited = new ArrayList<>();
        graph.dfs("a", (id, path, depth) -> {
            visited.add(id);
            return !id.equals("b");
        }, null);

        assertEquals(List.of("a", "b"), visited);
    }

    @Test
    void backEdgeReportsCurrentPathAndContinuesWithSiblings() {
        DirectedGraph graph = new DirectedGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");
        graph.addEdge("b", "c");

        List<String> backEdges = new ArrayList<>();
        List<String> visited = new ArrayList<>();
        graph.dfs("a", (id, path, depth) -> visited.add(id),
                (from, to, path) -> backEdges.add(from + "->" + to + " " + path));

        assertEquals(List.of("b->a [a, b]"), backEdges);
        assertEquals(List.of("a", "b", "c"), visited);
    }

    @Test
    void exceedingDepthCeilingIsFatal() {
        DirectedGraph graph = new DirectedGraph(3);
        for (int i = 0; i < 10; i++) {
            graph.addEdge("n" + i, "n" + (i + 1));
        }

        TraversalDepthExceededException e = assertThrows(TraversalDepthExceededException.class,
                () -> graph.dfs("n0", (id, path, depth) -> true, null));
        assertEquals("n4", e.nodeId());
        assertInstanceOf(IllegalStateException.class, e);
    }

    @Test
    void defaultCeilingAllowsLongChains() {
        DirectedGraph graph = new DirectedGraph();
        for (int i = 0; i < 5000; i++) {
            graph.addEdge("n" + i, "n" + (i + 1));
        }

        int[] deepest = {0};
        graph.dfs("n0", (id, path, depth) -> {
            deepest[0] = Math.max(deepest[0], depth);
            return true;
        }, null);
        assertEquals(5000, deepest[0]);
    }
}
