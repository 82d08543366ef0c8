package graph.flow;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import utilities.AlgoLogger;

import java.util.Arrays;
import java.util.List;

/**
 * Edmonds-Karp: repeatedly augment along a shortest residual path found by BFS.
 */
public final class EdmondsKarp implements MaxFlowAlgorithm {

    @Override
    public long maxFlow(FlowNetwork g, int s, int t) {
        g.checkTerminals(s, t);
        final int n = g.size();
        int[] prevNode = new int[n];
        int[] prevEdge = new int[n];
        long flow = 0L;
        int augmentations = 0;

        while (true) {
            Arrays.fill(prevNode, -1);
            prevNode[s] = s;
            IntArrayFIFOQueue q = new IntArrayFIFOQueue();
            q.enqueue(s);

            bfs:
            while (!q.isEmpty()) {
                int u = q.dequeueInt();
                List<FlowEdge> edges = g.adj(u);
                for (int i = 0; i < edges.size(); i++) {
                    FlowEdge e = edges.get(i);
                    if (e.residual() <= 0 || prevNode[e.to] != -1) {
                        continue;
                    }
                    prevNode[e.to] = u;
                    prevEdge[e.to] = i;
                    if (e.to == t) {
                        break bfs;
                    }
                    q.enqueue(e.to);
                }
            }
            if (prevNode[t] == -1) {
                break;
            }

            long bottleneck = Long.MAX_VALUE;
            for (int v = t; v != s; v = prevNode[v]) {
                bottleneck = Math.min(bottleneck, g.adj(prevNode[v]).get(prevEdge[v]).residual());
            }
            for (int v = t; v != s; v = prevNode[v]) {
                g.push(g.adj(prevNode[v]).get(prevEdge[v]), bottleneck);
            }
            flow += bottleneck;
            augmentations++;
        }
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Edmonds-Karp finished after " + augmentations + " augmentations with flow " + flow);
        }
        return flow;
    }
}
