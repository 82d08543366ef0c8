package graph.flow;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import utilities.AlgoLogger;

import java.util.Arrays;
import java.util.List;

/**
 * Dinic's max-flow: BFS level graph, then blocking flow along level-increasing edges.
 *
 * <p>Each phase keeps a current-edge pointer {@code ptr[u]} per node so that an edge found
 * useless is never scanned again in the same phase. Augmenting paths are found with an
 * explicit path stack instead of recursion; a node from which {@code t} turned out to be
 * unreachable is cut out of the level graph by setting its level to -1.</p>
 */
public final class Dinic implements MaxFlowAlgorithm {

    @Override
    public long maxFlow(FlowNetwork g, int s, int t) {
        g.checkTerminals(s, t);
        final int n = g.size();
        int[] level = new int[n];
        int[] ptr = new int[n];
        long flow = 0L;
        int phases = 0;

        while (buildLevelGraph(g, s, t, level)) {
            phases++;
            Arrays.fill(ptr, 0);
            long pushed;
            while ((pushed = augment(g, s, t, level, ptr)) > 0) {
                flow += pushed;
            }
        }
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Dinic finished after " + phases + " phases with flow " + flow);
        }
        return flow;
    }

    /**
     * Labels nodes with their BFS distance from {@code s} over edges with residual capacity.
     *
     * @return whether {@code t} is reachable
     */
    static boolean buildLevelGraph(FlowNetwork g, int s, int t, int[] level) {
        Arrays.fill(level, -1);
        level[s] = 0;
        IntArrayFIFOQueue q = new IntArrayFIFOQueue();
        q.enqueue(s);
        while (!q.isEmpty()) {
            int u = q.dequeueInt();
            for (FlowEdge e : g.adj(u)) {
                if (e.residual() > 0 && level[e.to] < 0) {
                    level[e.to] = level[u] + 1;
                    q.enqueue(e.to);
                }
            }
        }
        return level[t] >= 0;
    }

    /**
     * Finds one augmenting path in the level graph and pushes its bottleneck.
     *
     * @return the amount pushed, 0 when the phase is blocked
     */
    private static long augment(FlowNetwork g, int s, int t, int[] level, int[] ptr) {
        IntArrayList path = new IntArrayList();
        int u = s;
        while (true) {
            if (u == t) {
                long bottleneck = Long.MAX_VALUE;
                for (int i = 0; i < path.size(); i++) {
                    int x = path.getInt(i);
                    bottleneck = Math.min(bottleneck, g.adj(x).get(ptr[x]).residual());
                }
                for (int i = 0; i < path.size(); i++) {
                    int x = path.getInt(i);
                    g.push(g.adj(x).get(ptr[x]), bottleneck);
                }
                return bottleneck;
            }

            List<FlowEdge> edges = g.adj(u);
            boolean advanced = false;
            while (ptr[u] < edges.size()) {
                FlowEdge e = edges.get(ptr[u]);
                if (e.residual() > 0 && level[e.to] == level[u] + 1) {
                    path.push(u);
                    u = e.to;
                    advanced = true;
                    break;
                }
                ptr[u]++;
            }
            if (advanced) {
                continue;
            }

            // Dead end: drop u from this phase and retreat.
            level[u] = -1;
            if (path.isEmpty()) {
                return 0L;
            }
            u = path.popInt();
            ptr[u]++;
        }
    }
}
