package graph.flow;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;
import java.util.List;

/**
 * Ford-Fulkerson with depth-first augmenting paths.
 *
 * <p>Only meant for integer capacities, which all {@link FlowNetwork} capacities are: with
 * real-valued capacities the DFS variant may fail to terminate. The running time depends on
 * the flow value, so prefer {@link Dinic} for anything large.</p>
 */
public final class FordFulkerson implements MaxFlowAlgorithm {

    @Override
    public long maxFlow(FlowNetwork g, int s, int t) {
        g.checkTerminals(s, t);
        final int n = g.size();
        boolean[] visited = new boolean[n];
        int[] cursor = new int[n];
        long flow = 0L;

        while (true) {
            Arrays.fill(visited, false);
            Arrays.fill(cursor, 0);
            IntArrayList path = findPath(g, s, t, visited, cursor);
            if (path == null) {
                return flow;
            }
            long bottleneck = Long.MAX_VALUE;
            for (int i = 0; i < path.size(); i++) {
                int u = path.getInt(i);
                bottleneck = Math.min(bottleneck, g.adj(u).get(cursor[u]).residual());
            }
            for (int i = 0; i < path.size(); i++) {
                int u = path.getInt(i);
                g.push(g.adj(u).get(cursor[u]), bottleneck);
            }
            flow += bottleneck;
        }
    }

    /**
     * Iterative DFS. On success returns the nodes of the path except {@code t}; the edge taken
     * out of each node is {@code adj(u).get(cursor[u])}.
     */
    private static IntArrayList findPath(FlowNetwork g, int s, int t, boolean[] visited, int[] cursor) {
        IntArrayList stack = new IntArrayList();
        stack.push(s);
        visited[s] = true;
        while (!stack.isEmpty()) {
            int u = stack.topInt();
            List<FlowEdge> edges = g.adj(u);
            boolean advanced = false;
            while (cursor[u] < edges.size()) {
                FlowEdge e = edges.get(cursor[u]);
                if (e.residual() > 0 && !visited[e.to]) {
                    if (e.to == t) {
                        return stack;
                    }
                    visited[e.to] = true;
                    stack.push(e.to);
                    advanced = true;
                    break;
                }
                cursor[u]++;
            }
            if (!advanced) {
                stack.popInt();
                if (!stack.isEmpty()) {
                    cursor[stack.topInt()]++;
                }
            }
        }
        return null;
    }
}
