package graph.paths;

import graph.Graphs;

import java.util.Arrays;
import java.util.List;

/**
 * Bellman-Ford single-source shortest paths over an edge list, negative weights allowed.
 *
 * <p>A negative cycle reachable from the source is reported through
 * {@link ShortestPaths#hasNegativeCycle()} rather than thrown.</p>
 */
public final class BellmanFord {

    private BellmanFord() {
    }

    public static ShortestPaths run(int n, List<WeightedEdge> edges, int source) {
        Graphs.checkNode(n, source);
        for (WeightedEdge e : edges) {
            Graphs.checkNode(n, e.from);
            Graphs.checkNode(n, e.to);
        }

        long[] dist = new long[n];
        int[] pred = new int[n];
        Arrays.fill(dist, ShortestPaths.UNREACHABLE);
        Arrays.fill(pred, -1);
        dist[source] = 0L;

        for (int round = 1; round < n; round++) {
            boolean changed = false;
            for (WeightedEdge e : edges) {
                if (relaxes(dist, e)) {
                    dist[e.to] = dist[e.from] + e.weight;
                    pred[e.to] = e.from;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }

        boolean negativeCycle = false;
        for (WeightedEdge e : edges) {
            if (relaxes(dist, e)) {
                negativeCycle = true;
                break;
            }
        }
        return new ShortestPaths(source, dist, pred, negativeCycle);
    }

    private static boolean relaxes(long[] dist, WeightedEdge e) {
        return dist[e.from] != ShortestPaths.UNREACHABLE && dist[e.from] + e.weight < dist[e.to];
    }
}
