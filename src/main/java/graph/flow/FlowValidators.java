package graph.flow;

import java.util.List;

/**
 * Certificate checks for a flow left on a {@link FlowNetwork}.
 *
 * <p>Used by tests and by callers that want to verify a flow they did not compute themselves.</p>
 */
public final class FlowValidators {

    private FlowValidators() {
    }

    /**
     * {@code 0 <= flow <= cap} on every forward edge.
     */
    public static boolean capacityConstraints(FlowNetwork g) {
        for (int u = 0; u < g.size(); u++) {
            for (FlowEdge e : g.adj(u)) {
                if (e.isForward() && (e.flow() < 0L || e.flow() > e.cap)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Every edge and its partner carry opposite flow.
     */
    public static boolean skewSymmetry(FlowNetwork g) {
        for (int u = 0; u < g.size(); u++) {
            for (FlowEdge e : g.adj(u)) {
                if (e.flow() + g.partner(e).flow() != 0L) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Inflow equals outflow at every node except {@code s} and {@code t}, and what leaves
     * {@code s} arrives at {@code t}.
     */
    public static boolean flowConservation(FlowNetwork g, int s, int t) {
        for (int u = 0; u < g.size(); u++) {
            if (u != s && u != t && g.outflow(u) != 0L) {
                return false;
            }
        }
        return g.outflow(s) == -g.outflow(t);
    }

    /**
     * No residual path from {@code s} to {@code t}, and every forward edge crossing the
     * residual cut is saturated. Together with the two checks above this proves the flow
     * is maximum.
     */
    public static boolean saturatedCutExists(FlowNetwork g, int s, int t) {
        boolean[] inS = MinCut.sourceSide(g, s);
        if (inS[t]) {
            return false;
        }
        for (int u = 0; u < g.size(); u++) {
            if (!inS[u]) {
                continue;
            }
            List<FlowEdge> edges = g.adj(u);
            for (FlowEdge e : edges) {
                if (e.isForward() && !inS[e.to] && e.residual() > 0) {
                    return false;
                }
            }
        }
        return true;
    }
}
