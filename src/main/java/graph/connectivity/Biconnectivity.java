package graph.connectivity;

import graph.Graphs;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Bridges, cut nodes and 2-edge-connected components of an undirected graph, plus the
 * block forest that joins those components along the bridges.
 *
 * <p>The graph is given as a symmetric adjacency list: an undirected edge {@code {u, v}}
 * appears once in {@code adj[u]} and once in {@code adj[v]}. Parallel edges are allowed.
 * When scanning the neighbours of {@code u}, only the first occurrence of the DFS parent is
 * treated as the tree edge; further copies count as back edges, so a doubled edge is never
 * reported as a bridge.</p>
 *
 * <p>The traversal keeps an explicit stack of frames, so recursion depth is never an issue.
 * Output order matches the recursive algorithm: cut nodes and components in DFS finishing
 * order, bridges in the order their child subtree finishes.</p>
 */
public final class Biconnectivity {

    private final List<int[]> bridges;
    private final IntList cutNodes;
    private final List<IntList> components;
    private final int[] componentOf;
    private final List<IntList> blockForest;

    private Biconnectivity(List<int[]> bridges, IntList cutNodes, List<IntList> components,
                           int[] componentOf, List<IntList> blockForest) {
        this.bridges = bridges;
        this.cutNodes = IntLists.unmodifiable(cutNodes);
        this.components = readOnly(components);
        this.componentOf = componentOf;
        this.blockForest = readOnly(blockForest);
    }

    private static List<IntList> readOnly(List<IntList> lists) {
        List<IntList> out = new ArrayList<>(lists.size());
        for (IntList list : lists) {
            out.add(IntLists.unmodifiable(list));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * @throws utilities.AlgorithmException {@code INVALID_ARGUMENT} if {@code adj} is not a
     *                                      symmetric adjacency list
     */
    public static Biconnectivity of(int[][] adj) {
        Graphs.validateUndirected(adj);
        final int n = adj.length;

        int[] tin = new int[n];
        int[] low = new int[n];
        int[] parent = new int[n];
        int[] cursor = new int[n];
        int[] children = new int[n];
        boolean[] parentEdgeSeen = new boolean[n];
        boolean[] isCut = new boolean[n];
        Arrays.fill(tin, -1);

        IntArrayList nodeStack = new IntArrayList();
        IntArrayList callStack = new IntArrayList();
        List<int[]> bridges = new ArrayList<>();
        IntArrayList cutNodes = new IntArrayList();
        List<IntList> components = new ArrayList<>();
        int[] componentOf = new int[n];
        int timer = 0;

        for (int root = 0; root < n; root++) {
            if (tin[root] != -1) {
                continue;
            }
            tin[root] = low[root] = timer++;
            parent[root] = -1;
            nodeStack.push(root);
            callStack.push(root);

            while (!callStack.isEmpty()) {
                int u = callStack.topInt();
                if (cursor[u] < adj[u].length) {
                    int v = adj[u][cursor[u]++];
                    if (v == parent[u] && !parentEdgeSeen[u]) {
                        parentEdgeSeen[u] = true;
                        continue;
                    }
                    if (tin[v] == -1) {
                        parent[v] = u;
                        tin[v] = low[v] = timer++;
                        children[u]++;
                        nodeStack.push(v);
                        callStack.push(v);
                    } else {
                        low[u] = Math.min(low[u], tin[v]);
                    }
                    continue;
                }

                callStack.popInt();
                int p = parent[u];
                if (p == -1) {
                    isCut[u] = children[u] >= 2;
                }
                if (isCut[u]) {
                    cutNodes.add(u);
                }
                if (low[u] == tin[u]) {
                    IntArrayList component = new IntArrayList();
                    int w;
                    do {
                        w = nodeStack.popInt();
                        componentOf[w] = components.size();
                        component.add(w);
                    } while (w != u);
                    components.add(component);
                }
                if (p != -1) {
                    low[p] = Math.min(low[p], low[u]);
                    if (low[u] > tin[p]) {
                        bridges.add(new int[]{p, u});
                    }
                    if (low[u] >= tin[p] && parent[p] != -1) {
                        isCut[p] = true;
                    }
                }
            }
        }

        List<IntList> forest = new ArrayList<>(components.size());
        for (int c = 0; c < components.size(); c++) {
            forest.add(new IntArrayList());
        }
        for (int u = 0; u < n; u++) {
            for (int v : adj[u]) {
                if (componentOf[u] != componentOf[v]) {
                    forest.get(componentOf[u]).add(componentOf[v]);
                }
            }
        }

        return new Biconnectivity(bridges, cutNodes, components, componentOf, forest);
    }

    /**
     * Bridges as {@code {parent, child}} pairs of the DFS tree.
     */
    public List<int[]> bridges() {
        List<int[]> copy = new ArrayList<>(bridges.size());
        for (int[] bridge : bridges) {
            copy.add(bridge.clone());
        }
        return copy;
    }

    public IntList cutNodes() {
        return cutNodes;
    }

    /**
     * 2-edge-connected components. Removing every bridge leaves exactly these as the
     * connected components.
     */
    public List<IntList> components() {
        return components;
    }

    public int componentOf(int u) {
        Graphs.checkNode(componentOf.length, u);
        return componentOf[u];
    }

    /**
     * Adjacency list over component ids; one entry per bridge direction.
     */
    public List<IntList> blockForest() {
        return blockForest;
    }
}
