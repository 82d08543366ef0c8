package strings.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

/**
 * Knuth-Morris-Pratt single-pattern search.
 *
 * <p>{@link #failureTable(int[])} returns {@code f[0..m]}: {@code f[i]} is the length of the
 * longest proper prefix of {@code P[0..i)} that is also a suffix of it. The scan keeps the
 * length {@code j} of the current partial match and falls back to {@code f[j]} on a mismatch,
 * so the text is read once.</p>
 */
public final class Kmp {

    private Kmp() {
    }

    public static int[] failureTable(String pattern) {
        return failureTable(symbols(pattern));
    }

    public static int[] failureTable(int[] pattern) {
        checkPattern(pattern);
        final int m = pattern.length;
        int[] f = new int[m + 1];
        int j = 0;
        for (int i = 1; i < m; i++) {
            while (j > 0 && pattern[i] != pattern[j]) {
                j = f[j];
            }
            if (pattern[i] == pattern[j]) {
                j++;
            }
            f[i + 1] = j;
        }
        return f;
    }

    /**
     * All start positions of {@code pattern} in {@code text}, overlapping matches included.
     */
    public static IntList search(String text, String pattern) {
        return search(symbols(text), symbols(pattern));
    }

    public static IntList search(int[] text, int[] pattern) {
        int[] f = failureTable(pattern);
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        final int m = pattern.length;
        IntArrayList matches = new IntArrayList();
        int j = 0;
        for (int i = 0; i < text.length; i++) {
            while (j > 0 && text[i] != pattern[j]) {
                j = f[j];
            }
            if (text[i] == pattern[j]) {
                j++;
            }
            if (j == m) {
                matches.add(i - m + 1);
                j = f[m];
            }
        }
        return matches;
    }

    /**
     * First start position of {@code pattern} in {@code text}, or -1.
     */
    public static int findFirst(String text, String pattern) {
        int[] p = symbols(pattern);
        int[] f = failureTable(p);
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        final int m = p.length;
        int j = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            while (j > 0 && c != p[j]) {
                j = f[j];
            }
            if (c == p[j]) {
                j++;
            }
            if (j == m) {
                return i - m + 1;
            }
        }
        return -1;
    }

    private static void checkPattern(int[] pattern) {
        if (pattern == null || pattern.length == 0) {
            throw AlgorithmException.invalidArgument("pattern must be non-empty");
        }
    }

    static int[] symbols(String s) {
        return s == null ? null : s.chars().toArray();
    }
}
