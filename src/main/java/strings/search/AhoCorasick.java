package strings.search;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMaps;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aho-Corasick automaton over a fixed set of needles.
 *
 * <p>The trie is an arena of states; transitions are ordered maps from char to state, so a
 * lookup costs {@code O(log sigma)}. Failure links are computed breadth-first, which guarantees
 * that the link of a node's parent is known when the node is processed. Each state's output is
 * the sorted set of needle indices ending there, merged with the output of its failure link.</p>
 *
 * <p>The automaton is immutable after construction and can be shared between searches.</p>
 */
public final class AhoCorasick {

    /**
     * One occurrence: needle {@code pattern} found at {@code [start, start + length)}.
     */
    public static final class Match {
        public final int pattern;
        public final int start;

        public Match(int pattern, int start) {
            this.pattern = pattern;
            this.start = start;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Match)) {
                return false;
            }
            Match other = (Match) o;
            return pattern == other.pattern && start == other.start;
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern, start);
        }

        @Override
        public String toString() {
            return "Match{pattern=" + pattern + ", start=" + start + "}";
        }
    }

    private final List<String> needles;
    private final List<Int2IntSortedMap> go = new ArrayList<>();
    private final IntArrayList fail = new IntArrayList();
    private final List<int[]> out = new ArrayList<>();

    public AhoCorasick(List<String> needles) {
        if (needles == null) {
            throw AlgorithmException.invalidArgument("needles must be non-null");
        }
        for (int i = 0; i < needles.size(); i++) {
            String needle = needles.get(i);
            if (needle == null || needle.isEmpty()) {
                throw AlgorithmException.invalidArgument("needle %d must be a non-empty string", i);
            }
        }
        this.needles = List.copyOf(needles);

        List<IntArrayList> ending = new ArrayList<>();
        newState(ending);
        for (int i = 0; i < this.needles.size(); i++) {
            String needle = this.needles.get(i);
            int cur = 0;
            for (int k = 0; k < needle.length(); k++) {
                char c = needle.charAt(k);
                int nxt = go.get(cur).get(c);
                if (nxt == -1) {
                    nxt = newState(ending);
                    go.get(cur).put(c, nxt);
                }
                cur = nxt;
            }
            ending.get(cur).add(i);
        }
        buildFailureLinks(ending);
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Aho-Corasick automaton: " + needles.size() + " needles, " + go.size() + " states");
        }
    }

    private int newState(List<IntArrayList> ending) {
        Int2IntRBTreeMap transitions = new Int2IntRBTreeMap();
        transitions.defaultReturnValue(-1);
        go.add(transitions);
        fail.add(0);
        ending.add(new IntArrayList());
        out.add(null);
        return go.size() - 1;
    }

    private void buildFailureLinks(List<IntArrayList> ending) {
        IntArrayFIFOQueue q = new IntArrayFIFOQueue();
        out.set(0, ending.get(0).toIntArray());
        for (int child : go.get(0).values()) {
            fail.set(child, 0);
            out.set(child, ending.get(child).toIntArray());
            q.enqueue(child);
        }
        while (!q.isEmpty()) {
            int s = q.dequeueInt();
            for (Int2IntMap.Entry e : go.get(s).int2IntEntrySet()) {
                int c = e.getIntKey();
                int t = e.getIntValue();
                int f = fail.getInt(s);
                while (f != 0 && go.get(f).get(c) == -1) {
                    f = fail.getInt(f);
                }
                int target = go.get(f).get(c);
                f = target == -1 ? 0 : target;
                fail.set(t, f);
                out.set(t, union(ending.get(t).toIntArray(), out.get(f)));
                q.enqueue(t);
            }
        }
    }

    private static int[] union(int[] own, int[] inherited) {
        if (inherited.length == 0) {
            return own;
        }
        int[] merged = new int[own.length + inherited.length];
        System.arraycopy(own, 0, merged, 0, own.length);
        System.arraycopy(inherited, 0, merged, own.length, inherited.length);
        IntArrays.quickSort(merged);
        return merged;
    }

    /**
     * Follows failure links from {@code state} until a transition on {@code c} exists, then
     * takes it. The root absorbs characters it has no transition for.
     */
    public int nextState(int state, char c) {
        int s = state;
        while (true) {
            int t = go.get(s).get(c);
            if (t != -1) {
                return t;
            }
            if (s == 0) {
                return 0;
            }
            s = fail.getInt(s);
        }
    }

    /**
     * All occurrences of all needles, ordered by end position and then by needle index.
     */
    public List<Match> search(String text) {
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        List<Match> matches = new ArrayList<>();
        int state = 0;
        for (int i = 0; i < text.length(); i++) {
            state = nextState(state, text.charAt(i));
            for (int p : out.get(state)) {
                matches.add(new Match(p, i - needles.get(p).length() + 1));
            }
        }
        return matches;
    }

    public int stateCount() {
        return go.size();
    }

    public int failureLink(int state) {
        return fail.getInt(state);
    }

    /**
     * Sorted needle indices reported when the automaton is in {@code state}.
     */
    public int[] outputs(int state) {
        return out.get(state).clone();
    }

    /**
     * Transitions of {@code state} as an unmodifiable ordered map from char to state.
     */
    public Int2IntSortedMap transitions(int state) {
        return Int2IntSortedMaps.unmodifiable(go.get(state));
    }

    public List<String> needles() {
        return Collections.unmodifiableList(needles);
    }
}
