package graph.flow;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

/**
 * Minimum cut read off a maximum flow.
 */
public final class MinCut {

    private MinCut() {
    }

    /**
     * Nodes reachable from {@code s} through edges with positive residual capacity.
     * After a max-flow run the edges leaving this set form a minimum cut.
     */
    public static boolean[] sourceSide(FlowNetwork g, int s) {
        boolean[] seen = new boolean[g.size()];
        seen[s] = true;
        IntArrayFIFOQueue q = new IntArrayFIFOQueue();
        q.enqueue(s);
        while (!q.isEmpty()) {
            int u = q.dequeueInt();
            for (FlowEdge e : g.adj(u)) {
                if (e.residual() > 0 && !seen[e.to]) {
                    seen[e.to] = true;
                    q.enqueue(e.to);
                }
            }
        }
        return seen;
    }

    /**
     * Total capacity of the forward edges leaving the source side.
     */
    public static long capacity(FlowNetwork g, int s) {
        boolean[] side = sourceSide(g, s);
        long total = 0L;
        for (int u = 0; u < g.size(); u++) {
            if (!side[u]) {
                continue;
            }
            for (FlowEdge e : g.adj(u)) {
                if (e.isForward() && !side[e.to]) {
                    total += e.cap;
                }
            }
        }
        return total;
    }
}
