package graph.paths;

import graph.Graphs;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

/**
 * Single-source shortest-path tree: distances plus predecessor links.
 *
 * <p>Unreachable nodes have distance {@link #UNREACHABLE} and predecessor -1. When the solver
 * detected a negative cycle reachable from the source the distances are meaningless;
 * {@link #hasNegativeCycle()} reports this and {@link #distancesOrThrow()} turns it into an
 * exception.</p>
 */
public final class ShortestPaths {

    public static final long UNREACHABLE = Long.MAX_VALUE;

    private final int source;
    private final long[] dist;
    private final int[] pred;
    private final boolean negativeCycle;

    ShortestPaths(int source, long[] dist, int[] pred, boolean negativeCycle) {
        this.source = source;
        this.dist = dist;
        this.pred = pred;
        this.negativeCycle = negativeCycle;
    }

    public int source() {
        return source;
    }

    public boolean hasNegativeCycle() {
        return negativeCycle;
    }

    public long distance(int v) {
        Graphs.checkNode(dist.length, v);
        return dist[v];
    }

    public boolean reachable(int v) {
        return distance(v) != UNREACHABLE;
    }

    public int predecessor(int v) {
        Graphs.checkNode(pred.length, v);
        return pred[v];
    }

    public long[] distancesOrThrow() {
        if (negativeCycle) {
            throw AlgorithmException.negativeCycle("a negative cycle is reachable from node %d", source);
        }
        return dist.clone();
    }

    /**
     * Nodes on the shortest path from the source to {@code v}, both ends included.
     * Empty when {@code v} is unreachable.
     */
    public IntList pathTo(int v) {
        if (negativeCycle) {
            throw AlgorithmException.negativeCycle("a negative cycle is reachable from node %d", source);
        }
        IntArrayList path = new IntArrayList();
        if (!reachable(v)) {
            return path;
        }
        for (int x = v; x != -1; x = pred[x]) {
            path.add(x);
        }
        IntArrayList forward = new IntArrayList(path.size());
        for (int i = path.size() - 1; i >= 0; i--) {
            forward.add(path.getInt(i));
        }
        return forward;
    }
}
