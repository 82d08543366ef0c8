package graph.flow;

/**
 * Directed edge of a {@link FlowNetwork}.
 *
 * <p>Every edge added through {@link FlowNetwork#addEdge(int, int, long)} comes with a partner
 * edge of capacity 0 stored at the head node. {@code rev} is the index of that partner in the
 * head's adjacency list, so {@code network.adj(e.to).get(e.rev)} is always the partner of
 * {@code e}. Pushing flow along one edge pulls the same amount back along the partner, which
 * keeps {@code e.flow + partner.flow == 0} and {@code 0 <= residual()} on both.</p>
 */
public final class FlowEdge {

    /** Head node. */
    public final int to;

    /** Index of the partner edge in {@code adj(to)}. */
    public final int rev;

    /** Capacity; 0 for partner edges. */
    public final long cap;

    /** Current flow; negative on partner edges that carry flow back. */
    long flow;

    private final boolean forward;

    FlowEdge(int to, int rev, long cap, boolean forward) {
        this.to = to;
        this.rev = rev;
        this.cap = cap;
        this.forward = forward;
    }

    public long flow() {
        return flow;
    }

    public long residual() {
        return cap - flow;
    }

    /**
     * True for edges added by the caller, false for the generated partner edges.
     */
    public boolean isForward() {
        return forward;
    }

    @Override
    public String toString() {
        return "->" + to + " " + flow + "/" + cap;
    }
}
