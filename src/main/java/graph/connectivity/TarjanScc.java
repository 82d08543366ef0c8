package graph.connectivity;

import graph.Graphs;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tarjan's strongly connected components.
 *
 * <p>Components are emitted in reverse topological order of the condensation: if an edge
 * leads from component {@code A} to a different component {@code B}, then {@code B} is
 * emitted before {@code A}. Within a component, nodes appear in the order they are popped
 * off the node stack.</p>
 *
 * <p>{@link #components(int[][])} walks the graph with an explicit stack of
 * {@code (node, edge cursor)} frames and is safe for any input size.
 * {@link #componentsRecursive(int[][])} is the textbook recursive form; its depth grows with
 * the longest DFS path, so it is only meant for small graphs. Both return identical output.</p>
 */
public final class TarjanScc {

    private TarjanScc() {
    }

    public static List<IntList> components(int[][] adj) {
        Graphs.validate(adj);
        final int n = adj.length;

        int[] tin = new int[n];
        int[] low = new int[n];
        int[] cursor = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(tin, -1);

        IntArrayList nodeStack = new IntArrayList();
        IntArrayList callStack = new IntArrayList();
        List<IntList> out = new ArrayList<>();
        int timer = 0;

        for (int root = 0; root < n; root++) {
            if (tin[root] != -1) {
                continue;
            }
            tin[root] = low[root] = timer++;
            nodeStack.push(root);
            onStack[root] = true;
            callStack.push(root);

            while (!callStack.isEmpty()) {
                int u = callStack.topInt();
                if (cursor[u] < adj[u].length) {
                    int v = adj[u][cursor[u]++];
                    if (tin[v] == -1) {
                        tin[v] = low[v] = timer++;
                        nodeStack.push(v);
                        onStack[v] = true;
                        callStack.push(v);
                    } else if (onStack[v]) {
                        low[u] = Math.min(low[u], tin[v]);
                    }
                    continue;
                }

                // Frame finished: u's subtree is fully explored.
                callStack.popInt();
                if (low[u] == tin[u]) {
                    out.add(popComponent(nodeStack, onStack, u));
                }
                if (!callStack.isEmpty()) {
                    int parent = callStack.topInt();
                    low[parent] = Math.min(low[parent], low[u]);
                }
            }
        }
        return out;
    }

    public static List<IntList> componentsRecursive(int[][] adj) {
        Graphs.validate(adj);
        RecursiveState st = new RecursiveState(adj);
        for (int u = 0; u < adj.length; u++) {
            if (st.tin[u] == -1) {
                st.dfs(u);
            }
        }
        return st.out;
    }

    /**
     * Labels every node with the index of its component in {@link #components(int[][])} order.
     * For every edge {@code u -> v} between different components, {@code id[u] > id[v]}.
     */
    public static int[] componentIds(int[][] adj) {
        List<IntList> comps = components(adj);
        int[] id = new int[adj.length];
        for (int c = 0; c < comps.size(); c++) {
            for (int u : comps.get(c)) {
                id[u] = c;
            }
        }
        return id;
    }

    private static IntList popComponent(IntArrayList nodeStack, boolean[] onStack, int u) {
        IntArrayList component = new IntArrayList();
        int v;
        do {
            v = nodeStack.popInt();
            onStack[v] = false;
            component.add(v);
        } while (v != u);
        return component;
    }

    private static final class RecursiveState {
        final int[][] adj;
        final int[] tin;
        final int[] low;
        final boolean[] onStack;
        final IntArrayList nodeStack = new IntArrayList();
        final List<IntList> out = new ArrayList<>();
        int timer;

        RecursiveState(int[][] adj) {
            this.adj = adj;
            this.tin = new int[adj.length];
            this.low = new int[adj.length];
            this.onStack = new boolean[adj.length];
            Arrays.fill(tin, -1);
        }

        void dfs(int u) {
            tin[u] = low[u] = timer++;
            nodeStack.push(u);
            onStack[u] = true;
            for (int v : adj[u]) {
                if (tin[v] == -1) {
                    dfs(v);
                    low[u] = Math.min(low[u], low[v]);
                } else if (onStack[v]) {
                    low[u] = Math.min(low[u], tin[v]);
                }
            }
            if (low[u] == tin[u]) {
                out.add(popComponent(nodeStack, onStack, u));
            }
        }
    }
}
