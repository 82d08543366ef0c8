package strings.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import utilities.AlgorithmException;

/**
 * Z-function: {@code z[i]} is the length of the longest common prefix of {@code s} and
 * {@code s[i..]}. By convention {@code z[0] = n}.
 */
public final class ZFunction {

    private ZFunction() {
    }

    public static int[] compute(String s) {
        if (s == null) {
            throw AlgorithmException.invalidArgument("string must be non-null");
        }
        return compute(s.chars().toArray());
    }

    public static int[] compute(int[] s) {
        if (s == null) {
            throw AlgorithmException.invalidArgument("sequence must be non-null");
        }
        final int n = s.length;
        int[] z = new int[n];
        if (n == 0) {
            return z;
        }
        z[0] = n;
        // [l, r) is the rightmost window known to match a prefix.
        int l = 0;
        int r = 0;
        for (int i = 1; i < n; i++) {
            if (i < r) {
                z[i] = Math.min(r - i, z[i - l]);
            }
            while (i + z[i] < n && s[z[i]] == s[i + z[i]]) {
                z[i]++;
            }
            if (i + z[i] > r) {
                l = i;
                r = i + z[i];
            }
        }
        return z;
    }

    /**
     * All start positions of {@code pattern} in {@code text}, via the Z-function of
     * {@code pattern + separator + text}. The separator is -1, which no char can equal.
     */
    public static IntList search(String text, String pattern) {
        if (text == null || pattern == null || pattern.isEmpty()) {
            throw AlgorithmException.invalidArgument("text must be non-null and pattern non-empty");
        }
        final int m = pattern.length();
        int[] joined = new int[m + 1 + text.length()];
        for (int i = 0; i < m; i++) {
            joined[i] = pattern.charAt(i);
        }
        joined[m] = -1;
        for (int i = 0; i < text.length(); i++) {
            joined[m + 1 + i] = text.charAt(i);
        }
        int[] z = compute(joined);
        IntArrayList matches = new IntArrayList();
        for (int i = m + 1; i < joined.length; i++) {
            if (z[i] >= m) {
                matches.add(i - m - 1);
            }
        }
        return matches;
    }
}
