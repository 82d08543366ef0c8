package graph.matching;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Hopcroft-Karp maximum bipartite matching.
 *
 * <p>The left side is {@code [0, n1)}, the right side {@code [0, n2)} and {@code adj[u]} lists
 * the right neighbours of left node {@code u}. Each phase layers the left nodes by BFS from
 * all free left nodes at once, then searches vertex-disjoint shortest augmenting paths along
 * strictly increasing layers, stopping at the first layer that reaches a free right node, so
 * every path found in a phase has the same, shortest length. That length grows from phase
 * to phase and the number of phases is {@code O(sqrt(n1 + n2))}.</p>
 */
public final class HopcroftKarp {

    private final int n1;
    private final int[][] adj;
    private final int[] dist;
    private final int[] cursor;
    private final int[] via;
    private final int[] matchOfLeft;
    private final int[] matchOfRight;
    // Per phase, the layer of the left nodes that reach a free right node.
    private final IntArrayList phaseDistances = new IntArrayList();
    private int freeDistance;

    private HopcroftKarp(int n1, int n2, int[][] adj) {
        this.n1 = n1;
        this.adj = adj;
        this.dist = new int[n1];
        this.cursor = new int[n1];
        this.via = new int[n1];
        this.matchOfLeft = new int[n1];
        this.matchOfRight = new int[n2];
        Arrays.fill(matchOfLeft, -1);
        Arrays.fill(matchOfRight, -1);
    }

    public static Matching maxMatching(int n1, int n2, int[][] adj) {
        return run(n1, n2, adj).matching;
    }

    static Result run(int n1, int n2, int[][] adj) {
        validate(n1, n2, adj);
        HopcroftKarp hk = new HopcroftKarp(n1, n2, adj);
        int size = 0;
        while (hk.layer()) {
            hk.phaseDistances.add(hk.freeDistance);
            Arrays.fill(hk.cursor, 0);
            for (int u = 0; u < n1; u++) {
                if (hk.matchOfLeft[u] == -1 && hk.augment(u)) {
                    size++;
                }
            }
        }
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Hopcroft-Karp finished after " + hk.phaseDistances.size()
                    + " phases, matching size " + size);
        }
        return new Result(new Matching(size, hk.matchOfLeft, hk.matchOfRight), hk.phaseDistances);
    }

    static final class Result {
        final Matching matching;
        final IntArrayList phaseDistances;

        Result(Matching matching, IntArrayList phaseDistances) {
            this.matching = matching;
            this.phaseDistances = phaseDistances;
        }
    }

    /**
     * BFS from every free left node over alternating edges.
     *
     * Left nodes past the first layer with an edge to a free right node are not expanded;
     * that layer is kept in {@code freeDistance}.
     *
     * @return whether some free right node is reachable
     */
    private boolean layer() {
        IntArrayFIFOQueue q = new IntArrayFIFOQueue();
        for (int u = 0; u < n1; u++) {
            if (matchOfLeft[u] == -1) {
                dist[u] = 0;
                q.enqueue(u);
            } else {
                dist[u] = -1;
            }
        }
        freeDistance = Integer.MAX_VALUE;
        while (!q.isEmpty()) {
            int u = q.dequeueInt();
            if (dist[u] > freeDistance) {
                break;
            }
            for (int v : adj[u]) {
                int w = matchOfRight[v];
                if (w == -1) {
                    freeDistance = Math.min(freeDistance, dist[u]);
                } else if (dist[w] == -1 && dist[u] < freeDistance) {
                    dist[w] = dist[u] + 1;
                    q.enqueue(w);
                }
            }
        }
        return freeDistance != Integer.MAX_VALUE;
    }

    /**
     * Layered DFS from free left node {@code root} with an explicit stack. {@code via[u]} is the
     * right node used to leave left node {@code u}; on success the path is flipped.
     */
    private boolean augment(int root) {
        IntArrayList stack = new IntArrayList();
        stack.push(root);
        while (!stack.isEmpty()) {
            int u = stack.topInt();
            if (cursor[u] == adj[u].length) {
                // Exhausted: no augmenting path through u in this phase.
                dist[u] = -1;
                stack.popInt();
                continue;
            }
            int v = adj[u][cursor[u]++];
            int w = matchOfRight[v];
            if (w == -1) {
                if (dist[u] != freeDistance) {
                    continue;
                }
                via[u] = v;
                for (int i = 0; i < stack.size(); i++) {
                    int x = stack.getInt(i);
                    matchOfLeft[x] = via[x];
                    matchOfRight[via[x]] = x;
                }
                return true;
            }
            if (dist[w] == dist[u] + 1 && dist[w] <= freeDistance) {
                via[u] = v;
                stack.push(w);
            }
        }
        return false;
    }

    private static void validate(int n1, int n2, int[][] adj) {
        if (n1 < 0 || n2 < 0) {
            throw AlgorithmException.invalidArgument("side sizes must be non-negative, got %d and %d", n1, n2);
        }
        if (adj == null || adj.length != n1) {
            throw AlgorithmException.invalidArgument("adjacency list must have exactly %d rows", n1);
        }
        for (int u = 0; u < n1; u++) {
            if (adj[u] == null) {
                throw AlgorithmException.invalidArgument("adjacency row %d is null", u);
            }
            for (int v : adj[u]) {
                if (v < 0 || v >= n2) {
                    throw AlgorithmException.invalidArgument("left node %d lists right node %d outside [0, %d)", u, v, n2);
                }
            }
        }
    }
}
