package graph.connectivity;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

import java.util.List;

/**
 * Topological order of a directed acyclic graph, read off the SCC condensation.
 */
public final class TopologicalSort {

    private TopologicalSort() {
    }

    /**
     * @return the nodes ordered so that every edge {@code u -> v} has {@code u} before {@code v}
     * @throws AlgorithmException with kind {@code INVALID_ARGUMENT} if the graph has a cycle
     */
    public static IntList order(int[][] adj) {
        List<IntList> comps = TarjanScc.components(adj);
        IntArrayList order = new IntArrayList(adj.length);
        for (int c = comps.size() - 1; c >= 0; c--) {
            IntList comp = comps.get(c);
            if (comp.size() > 1) {
                throw AlgorithmException.invalidArgument("graph has a cycle through node %d", comp.getInt(0));
            }
            order.add(comp.getInt(0));
        }
        for (int u = 0; u < adj.length; u++) {
            for (int v : adj[u]) {
                if (v == u) {
                    throw AlgorithmException.invalidArgument("graph has a self-loop at node %d", u);
                }
            }
        }
        return order;
    }
}
