package strings.suffix;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Suffix automaton of a string, built online one character at a time.
 *
 * <p>States live in parallel arrays indexed by state id; state 0 is the initial state.
 * {@code length[v]} is the longest substring in the class of {@code v} and {@code link[v]}
 * its suffix link. {@code firstPos[v]} is the end position of the first occurrence of that
 * class. Clones inherit the first position of the state they were split from, and are
 * flagged so that occurrence listing counts every end position exactly once.</p>
 *
 * <p>Transitions are hash maps keyed by char, so any alphabet works.</p>
 */
public final class SuffixAutomaton {

    private final String text;
    private final int[] length;
    private final int[] link;
    private final int[] firstPos;
    private final boolean[] clone;
    private final Int2IntOpenHashMap[] next;
    private int size;

    // Inverse suffix links in CSR form, built after construction.
    private int[] childStart;
    private int[] children;

    public SuffixAutomaton(String text) {
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        this.text = text;
        int capacity = Math.max(2, 2 * text.length());
        this.length = new int[capacity];
        this.link = new int[capacity];
        this.firstPos = new int[capacity];
        this.clone = new boolean[capacity];
        this.next = new Int2IntOpenHashMap[capacity];

        link[0] = -1;
        firstPos[0] = -1;
        next[0] = newTransitions();
        size = 1;

        int last = 0;
        for (int i = 0; i < text.length(); i++) {
            last = extend(last, text.charAt(i), i);
        }
        buildInverseLinks();
    }

    private static Int2IntOpenHashMap newTransitions() {
        Int2IntOpenHashMap map = new Int2IntOpenHashMap(4);
        map.defaultReturnValue(-1);
        return map;
    }

    private int extend(int last, int c, int pos) {
        int cur = size++;
        length[cur] = length[last] + 1;
        firstPos[cur] = pos;
        next[cur] = newTransitions();

        int p = last;
        while (p != -1 && !next[p].containsKey(c)) {
            next[p].put(c, cur);
            p = link[p];
        }
        if (p == -1) {
            link[cur] = 0;
            return cur;
        }
        int q = next[p].get(c);
        if (length[p] + 1 == length[q]) {
            link[cur] = q;
            return cur;
        }

        // q holds two classes now; split off the shorter one.
        int cl = size++;
        length[cl] = length[p] + 1;
        link[cl] = link[q];
        firstPos[cl] = firstPos[q];
        clone[cl] = true;
        next[cl] = new Int2IntOpenHashMap(next[q]);
        next[cl].defaultReturnValue(-1);
        while (p != -1 && next[p].get(c) == q) {
            next[p].put(c, cl);
            p = link[p];
        }
        link[q] = cl;
        link[cur] = cl;
        return cur;
    }

    private void buildInverseLinks() {
        childStart = new int[size + 1];
        for (int v = 1; v < size; v++) {
            childStart[link[v] + 1]++;
        }
        for (int v = 0; v < size; v++) {
            childStart[v + 1] += childStart[v];
        }
        children = new int[Math.max(0, size - 1)];
        int[] fill = new int[size];
        for (int v = 1; v < size; v++) {
            int parent = link[v];
            children[childStart[parent] + fill[parent]++] = v;
        }
    }

    /**
     * State reached by reading {@code query} from the initial state, or -1.
     */
    private int walk(String query) {
        int state = 0;
        for (int i = 0; i < query.length() && state != -1; i++) {
            state = next[state].get(query.charAt(i));
        }
        return state;
    }

    public boolean contains(String query) {
        if (query == null) {
            throw AlgorithmException.invalidArgument("query must be non-null");
        }
        return walk(query) != -1;
    }

    /**
     * Start of the first occurrence of {@code query}, or -1.
     */
    public int firstOccurrence(String query) {
        checkQuery(query);
        int state = walk(query);
        return state == -1 ? -1 : firstPos[state] - query.length() + 1;
    }

    /**
     * Every start position of {@code query} in the text, ascending. Costs
     * O(|query| + z log z) for z occurrences; {@link #findAllUnordered(String)} skips the sort.
     */
    public IntList findAll(String query) {
        IntArrayList result = findAllUnordered(query);
        Arrays.sort(result.elements(), 0, result.size());
        return result;
    }

    /**
     * Every start position of {@code query} in the text in no particular order, in
     * O(|query| + z). The end positions are the first positions of the non-clone states in the
     * suffix-link subtree of the query's state.
     */
    public IntArrayList findAllUnordered(String query) {
        checkQuery(query);
        IntArrayList result = new IntArrayList();
        int state = walk(query);
        if (state == -1) {
            return result;
        }
        IntArrayList stack = new IntArrayList();
        stack.push(state);
        while (!stack.isEmpty()) {
            int v = stack.popInt();
            if (!clone[v]) {
                result.add(firstPos[v] - query.length() + 1);
            }
            for (int i = childStart[v]; i < childStart[v + 1]; i++) {
                stack.push(children[i]);
            }
        }
        return result;
    }

    /**
     * Longest substring of {@code other} that also occurs in this automaton's text. Ties go to
     * the leftmost end position in {@code other}.
     */
    public String longestCommonSubstring(String other) {
        if (other == null) {
            throw AlgorithmException.invalidArgument("string must be non-null");
        }
        int len = 0;
        int best = 0;
        int bestEnd = -1;
        int cur = 0;
        for (int i = 0; i < other.length(); i++) {
            char c = other.charAt(i);
            if (!next[cur].containsKey(c)) {
                while (cur != -1 && !next[cur].containsKey(c)) {
                    cur = link[cur];
                }
                if (cur == -1) {
                    cur = 0;
                    len = 0;
                    continue;
                }
                len = length[cur];
            }
            len++;
            cur = next[cur].get(c);
            if (len > best) {
                best = len;
                bestEnd = i;
            }
        }
        return bestEnd == -1 ? "" : other.substring(bestEnd - best + 1, bestEnd + 1);
    }

    /**
     * Number of distinct non-empty substrings of the text.
     */
    public long countDistinctSubstrings() {
        long total = 0L;
        for (int v = 1; v < size; v++) {
            total += length[v] - length[link[v]];
        }
        return total;
    }

    public int stateCount() {
        return size;
    }

    public int transitionCount() {
        int total = 0;
        for (int v = 0; v < size; v++) {
            total += next[v].size();
        }
        return total;
    }

    public String text() {
        return text;
    }

    private static void checkQuery(String query) {
        if (query == null || query.isEmpty()) {
            throw AlgorithmException.invalidArgument("query must be a non-empty string");
        }
    }
}
