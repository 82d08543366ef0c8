package graph;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the graph kernels.
 *
 * <p>Unweighted graphs are passed around as {@code int[][] adj} where {@code adj[u]} lists the
 * neighbours of {@code u} in visiting order. Nodes are the integers {@code 0..adj.length-1}.</p>
 */
public final class Graphs {

    private Graphs() {
        throw new AssertionError("Graphs must not be instantiated");
    }

    /**
     * Rejects null rows and edges that leave {@code [0, n)}.
     */
    public static void validate(int[][] adj) {
        if (adj == null) {
            throw AlgorithmException.invalidArgument("adjacency list must be non-null");
        }
        final int n = adj.length;
        for (int u = 0; u < n; u++) {
            if (adj[u] == null) {
                throw AlgorithmException.invalidArgument("adjacency row %d is null", u);
            }
            for (int v : adj[u]) {
                if (v < 0 || v >= n) {
                    throw AlgorithmException.invalidArgument(
                            "edge %d -> %d references a node outside [0, %d)", u, v, n);
                }
            }
        }
    }

    /**
     * {@link #validate} plus symmetry: {@code v} must occur in {@code adj[u]} exactly as often
     * as {@code u} occurs in {@code adj[v]}.
     */
    public static void validateUndirected(int[][] adj) {
        validate(adj);
        Long2IntOpenHashMap arcs = new Long2IntOpenHashMap();
        for (int u = 0; u < adj.length; u++) {
            for (int v : adj[u]) {
                arcs.addTo(arc(u, v), 1);
            }
        }
        for (Long2IntMap.Entry e : arcs.long2IntEntrySet()) {
            int u = (int) (e.getLongKey() >>> 32);
            int v = (int) e.getLongKey();
            int back = arcs.get(arc(v, u));
            if (back != e.getIntValue()) {
                throw AlgorithmException.invalidArgument(
                        "adjacency list is not symmetric: %d -> %d appears %d times, %d -> %d %d times",
                        u, v, e.getIntValue(), v, u, back);
            }
        }
    }

    private static long arc(int u, int v) {
        return ((long) u << 32) | (v & 0xFFFFFFFFL);
    }

    /**
     * Builds an adjacency list from an edge list of {@code {u, v}} pairs. Edge order is kept.
     *
     * @param undirected when true every pair is inserted in both directions
     */
    public static int[][] fromEdges(int n, int[][] edges, boolean undirected) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("node count must be non-negative, got %d", n);
        }
        List<List<Integer>> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rows.add(new ArrayList<>());
        }
        for (int[] e : edges) {
            if (e.length < 2) {
                throw AlgorithmException.invalidArgument("edge must have two endpoints");
            }
            int u = e[0];
            int v = e[1];
            checkNode(n, u);
            checkNode(n, v);
            rows.get(u).add(v);
            if (undirected) {
                rows.get(v).add(u);
            }
        }
        int[][] adj = new int[n][];
        for (int u = 0; u < n; u++) {
            List<Integer> row = rows.get(u);
            adj[u] = new int[row.size()];
            for (int i = 0; i < row.size(); i++) {
                adj[u][i] = row.get(i);
            }
        }
        return adj;
    }

    public static void checkNode(int n, int u) {
        if (u < 0 || u >= n) {
            throw AlgorithmException.invalidArgument("node %d is outside [0, %d)", u, n);
        }
    }
}
