package graph.flow;

import graph.Graphs;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.List;

/**
 * Residual network shared by the max-flow algorithms.
 *
 * <p>{@code adj(u)} lists the edges leaving {@code u}, including the zero-capacity partners of
 * edges that enter {@code u}. Max-flow routines mutate the flow stored on the edges in place;
 * call {@link #resetFlow()} to run another algorithm on the same network.</p>
 */
public final class FlowNetwork {

    private final int n;
    private final List<List<FlowEdge>> adj;

    public FlowNetwork(int n) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("node count must be non-negative, got %d", n);
        }
        this.n = n;
        this.adj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adj.add(new ArrayList<>());
        }
    }

    public int size() {
        return n;
    }

    public List<FlowEdge> adj(int u) {
        Graphs.checkNode(n, u);
        return adj.get(u);
    }

    /**
     * Adds the edge {@code u -> v} with capacity {@code cap} and its zero-capacity partner.
     *
     * @return the forward edge
     */
    public FlowEdge addEdge(int u, int v, long cap) {
        Graphs.checkNode(n, u);
        Graphs.checkNode(n, v);
        if (cap < 0) {
            throw AlgorithmException.invalidArgument("edge %d -> %d has negative capacity %d", u, v, cap);
        }
        // For a self-loop the partner lands right after the forward edge in the same list.
        int revIndex = u == v ? adj.get(v).size() + 1 : adj.get(v).size();
        FlowEdge fwd = new FlowEdge(v, revIndex, cap, true);
        FlowEdge back = new FlowEdge(u, adj.get(u).size(), 0L, false);
        adj.get(u).add(fwd);
        adj.get(v).add(back);
        return fwd;
    }

    public FlowEdge partner(FlowEdge e) {
        return adj.get(e.to).get(e.rev);
    }

    /**
     * Moves {@code amount} units along {@code e} and back along its partner.
     */
    void push(FlowEdge e, long amount) {
        e.flow += amount;
        partner(e).flow -= amount;
    }

    public void resetFlow() {
        for (List<FlowEdge> edges : adj) {
            for (FlowEdge e : edges) {
                e.flow = 0L;
            }
        }
    }

    /**
     * Net flow leaving {@code u}: flow on its outgoing edges minus flow on its incoming ones.
     */
    public long outflow(int u) {
        long total = 0L;
        for (FlowEdge e : adj(u)) {
            total += e.flow;
        }
        return total;
    }

    void checkTerminals(int s, int t) {
        Graphs.checkNode(n, s);
        Graphs.checkNode(n, t);
        if (s == t) {
            throw AlgorithmException.invalidArgument("source and sink must differ, both are %d", s);
        }
    }
}
