package graph.paths;

import graph.Graphs;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Dijkstra's single-source shortest paths with a binary heap and lazy deletion.
 * All weights must be non-negative.
 */
public final class Dijkstra {

    private Dijkstra() {
    }

    public static ShortestPaths run(int n, List<WeightedEdge> edges, int source) {
        Graphs.checkNode(n, source);
        List<List<WeightedEdge>> adj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adj.add(new ArrayList<>());
        }
        for (WeightedEdge e : edges) {
            Graphs.checkNode(n, e.from);
            Graphs.checkNode(n, e.to);
            if (e.weight < 0) {
                throw AlgorithmException.invalidArgument("edge %s has a negative weight", e);
            }
            adj.get(e.from).add(e);
        }

        long[] dist = new long[n];
        int[] pred = new int[n];
        Arrays.fill(dist, ShortestPaths.UNREACHABLE);
        Arrays.fill(pred, -1);
        dist[source] = 0L;

        PriorityQueue<long[]> pq = new PriorityQueue<>(Comparator.comparingLong((long[] entry) -> entry[0]));
        pq.add(new long[]{0L, source});
        while (!pq.isEmpty()) {
            long[] top = pq.poll();
            int u = (int) top[1];
            if (top[0] > dist[u]) {
                continue; // stale entry
            }
            for (WeightedEdge e : adj.get(u)) {
                long candidate = dist[u] + e.weight;
                if (candidate < dist[e.to]) {
                    dist[e.to] = candidate;
                    pred[e.to] = u;
                    pq.add(new long[]{candidate, e.to});
                }
            }
        }
        return new ShortestPaths(source, dist, pred, false);
    }
}
