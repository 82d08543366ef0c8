package graph.paths;

import graph.Graphs;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

import java.util.Arrays;
import java.util.List;

/**
 * All-pairs shortest paths. A negative entry on the diagonal after the run means some node
 * lies on a negative cycle.
 */
public final class FloydWarshall {

    private final long[][] dist;
    private final int[][] next;
    private final boolean negativeCycle;

    private FloydWarshall(long[][] dist, int[][] next, boolean negativeCycle) {
        this.dist = dist;
        this.next = next;
        this.negativeCycle = negativeCycle;
    }

    public static FloydWarshall run(int n, List<WeightedEdge> edges) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("node count must be non-negative, got %d", n);
        }
        final long inf = ShortestPaths.UNREACHABLE;
        long[][] dist = new long[n][n];
        int[][] next = new int[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(dist[i], inf);
            Arrays.fill(next[i], -1);
            dist[i][i] = 0L;
            next[i][i] = i;
        }
        for (WeightedEdge e : edges) {
            Graphs.checkNode(n, e.from);
            Graphs.checkNode(n, e.to);
            if (e.weight < dist[e.from][e.to]) {
                dist[e.from][e.to] = e.weight;
                next[e.from][e.to] = e.to;
            }
        }

        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (dist[i][k] == inf) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    if (dist[k][j] != inf && dist[i][k] + dist[k][j] < dist[i][j]) {
                        dist[i][j] = dist[i][k] + dist[k][j];
                        next[i][j] = next[i][k];
                    }
                }
            }
        }

        boolean negativeCycle = false;
        for (int i = 0; i < n; i++) {
            if (dist[i][i] < 0) {
                negativeCycle = true;
                break;
            }
        }
        return new FloydWarshall(dist, next, negativeCycle);
    }

    public boolean hasNegativeCycle() {
        return negativeCycle;
    }

    public long distance(int u, int v) {
        checkNoNegativeCycle();
        Graphs.checkNode(dist.length, u);
        Graphs.checkNode(dist.length, v);
        return dist[u][v];
    }

    /**
     * Nodes of a shortest {@code u -> v} path, both ends included; empty if unreachable.
     */
    public IntList path(int u, int v) {
        checkNoNegativeCycle();
        Graphs.checkNode(dist.length, u);
        Graphs.checkNode(dist.length, v);
        IntArrayList path = new IntArrayList();
        if (next[u][v] == -1) {
            return path;
        }
        path.add(u);
        for (int x = u; x != v; ) {
            x = next[x][v];
            path.add(x);
        }
        return path;
    }

    private void checkNoNegativeCycle() {
        if (negativeCycle) {
            throw AlgorithmException.negativeCycle("distance matrix has a negative diagonal entry");
        }
    }
}
