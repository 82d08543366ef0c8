package graph.connectivity;

import graph.Graphs;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TarjanSccTest {

    private static final int[][] EXAMPLE = Graphs.fromEdges(8, new int[][]{
            {0, 1}, {1, 2}, {1, 4}, {1, 5}, {2, 3}, {2, 6}, {3, 2}, {3, 7},
            {4, 0}, {4, 5}, {5, 6}, {6, 5}, {7, 3}, {7, 6}}, false);

    @Test
    void findsComponentsInReverseTopologicalOrder() {
        List<IntList> comps = TarjanScc.components(EXAMPLE);
        assertEquals(List.of(List.of(5, 6), List.of(7, 3, 2), List.of(4, 1, 0)), comps);
    }

    @Test
    void recursiveAndIterativeAgree() {
        Random rnd = new Random(7);
        for (int trial = 0; trial < 200; trial++) {
            int n = 1 + rnd.nextInt(30);
            int m = rnd.nextInt(3 * n);
            int[][] edges = new int[m][];
            for (int i = 0; i < m; i++) {
                edges[i] = new int[]{rnd.nextInt(n), rnd.nextInt(n)};
            }
            int[][] adj = Graphs.fromEdges(n, edges, false);
            assertEquals(TarjanScc.componentsRecursive(adj), TarjanScc.components(adj));
        }
    }

    @Test
    void crossComponentEdgesPointToEarlierComponents() {
        Random rnd = new Random(11);
        for (int trial = 0; trial < 100; trial++) {
            int n = 1 + rnd.nextInt(40);
            int m = rnd.nextInt(2 * n);
            int[][] edges = new int[m][];
            for (int i = 0; i < m; i++) {
                edges[i] = new int[]{rnd.nextInt(n), rnd.nextInt(n)};
            }
            int[][] adj = Graphs.fromEdges(n, edges, false);
            int[] id = TarjanScc.componentIds(adj);
            for (int u = 0; u < n; u++) {
                for (int v : adj[u]) {
                    assertTrue(id[u] >= id[v], "edge " + u + "->" + v);
                }
            }
        }
    }

    @Test
    void handlesLongPathWithoutRecursion() {
        int n = 200_000;
        int[][] adj = new int[n][];
        for (int u = 0; u < n; u++) {
            adj[u] = u + 1 < n ? new int[]{u + 1} : new int[]{0};
        }
        List<IntList> comps = TarjanScc.components(adj);
        assertEquals(1, comps.size());
        assertEquals(n, comps.get(0).size());
    }

    @Test
    void rejectsEdgesOutsideTheGraph() {
        AlgorithmException e = assertThrows(AlgorithmException.class,
                () -> TarjanScc.components(new int[][]{{1}, {2}}));
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT, e.kind());
    }
}
