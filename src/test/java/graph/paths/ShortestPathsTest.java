package graph.paths;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShortestPathsTest {

    private static final List<WeightedEdge> TRIANGLE = List.of(
            new WeightedEdge(0, 1, 1), new WeightedEdge(1, 2, 2), new WeightedEdge(0, 2, 5));

    @Test
    void allSolversFindTheTwoHopPath() {
        ShortestPaths d = Dijkstra.run(3, TRIANGLE, 0);
        ShortestPaths b = BellmanFord.run(3, TRIANGLE, 0);
        FloydWarshall f = FloydWarshall.run(3, TRIANGLE);
        assertEquals(3L, d.distance(2));
        assertEquals(3L, b.distance(2));
        assertEquals(3L, f.distance(0, 2));
        assertEquals(List.of(0, 1, 2), d.pathTo(2));
        assertEquals(List.of(0, 1, 2), b.pathTo(2));
        assertEquals(List.of(0, 1, 2), f.path(0, 2));
    }

    @Test
    void unreachableNodes() {
        ShortestPaths d = Dijkstra.run(4, TRIANGLE, 0);
        assertFalse(d.reachable(3));
        assertEquals(ShortestPaths.UNREACHABLE, d.distance(3));
        assertTrue(d.pathTo(3).isEmpty());
        assertTrue(FloydWarshall.run(4, TRIANGLE).path(0, 3).isEmpty());
    }

    @Test
    void negativeCycleIsReportedNotThrown() {
        List<WeightedEdge> edges = List.of(
                new WeightedEdge(0, 1, 1), new WeightedEdge(1, 2, -2), new WeightedEdge(2, 1, 1));
        ShortestPaths b = BellmanFord.run(3, edges, 0);
        assertTrue(b.hasNegativeCycle());
        AlgorithmException e = assertThrows(AlgorithmException.class, b::distancesOrThrow);
        assertEquals(AlgorithmException.Kind.NEGATIVE_CYCLE, e.kind());
        assertTrue(FloydWarshall.run(3, edges).hasNegativeCycle());
    }

    @Test
    void unreachableNegativeCycleIsIgnored() {
        List<WeightedEdge> edges = List.of(
                new WeightedEdge(0, 1, 4), new WeightedEdge(2, 3, -2), new WeightedEdge(3, 2, 1));
        ShortestPaths b = BellmanFord.run(4, edges, 0);
        assertFalse(b.hasNegativeCycle());
        assertEquals(4L, b.distancesOrThrow()[1]);
    }

    @Test
    void dijkstraRejectsNegativeWeights() {
        assertThrows(AlgorithmException.class,
                () -> Dijkstra.run(2, List.of(new WeightedEdge(0, 1, -1)), 0));
    }

    @Test
    void solversAgreeOnRandomGraphs() {
        Random rnd = new Random(9);
        for (int trial = 0; trial < 100; trial++) {
            int n = 1 + rnd.nextInt(15);
            List<WeightedEdge> edges = new ArrayList<>();
            int m = rnd.nextInt(4 * n);
            for (int i = 0; i < m; i++) {
                edges.add(new WeightedEdge(rnd.nextInt(n), rnd.nextInt(n), rnd.nextInt(50)));
            }
            ShortestPaths d = Dijkstra.run(n, edges, 0);
            ShortestPaths b = BellmanFord.run(n, edges, 0);
            FloydWarshall f = FloydWarshall.run(n, edges);
            for (int v = 0; v < n; v++) {
                assertEquals(d.distance(v), b.distance(v));
                assertEquals(d.distance(v), f.distance(0, v));
                long walked = 0;
                List<Integer> path = d.pathTo(v);
                for (int i = 0; i + 1 < path.size(); i++) {
                    walked += cheapest(edges, path.get(i), path.get(i + 1));
                }
                if (d.reachable(v)) {
                    assertEquals(d.distance(v), walked);
                }
            }
        }
    }

    private static long cheapest(List<WeightedEdge> edges, int u, int v) {
        long best = Long.MAX_VALUE;
        for (WeightedEdge e : edges) {
            if (e.from == u && e.to == v) {
                best = Math.min(best, e.weight);
            }
        }
        return best;
    }
}
