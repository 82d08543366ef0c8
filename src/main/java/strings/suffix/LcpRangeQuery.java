package strings.suffix;

import utilities.AlgorithmException;

/**
 * Longest common prefix of any two suffixes in O(1), after O(n log n) preprocessing.
 *
 * <p>A sparse table over the LCP array answers range minima; the LCP of the suffixes at
 * ranks {@code r1 < r2} is {@code min(lcp[r1..r2-1])}.</p>
 */
public final class LcpRangeQuery {

    private final int n;
    private final int[] rank;
    private final int[] log2;
    private final int[][] st; // st[k][i] = min of lcp[i .. i + 2^k)

    public LcpRangeQuery(int[] sa, int[] lcp) {
        if (sa == null || lcp == null) {
            throw AlgorithmException.invalidArgument("suffix array and lcp array must be non-null");
        }
        if (sa.length != 0 && lcp.length != sa.length - 1) {
            throw AlgorithmException.invalidArgument("lcp array must have %d entries, got %d", sa.length - 1, lcp.length);
        }
        this.n = sa.length;
        this.rank = new int[n];
        for (int i = 0; i < n; i++) {
            rank[sa[i]] = i;
        }

        int m = lcp.length;
        this.log2 = new int[m + 1];
        for (int i = 2; i <= m; i++) {
            log2[i] = log2[i >> 1] + 1;
        }
        int levels = m == 0 ? 0 : 31 - Integer.numberOfLeadingZeros(m);
        this.st = new int[levels + 1][];
        st[0] = lcp.clone();
        for (int k = 1; k <= levels; k++) {
            int half = 1 << (k - 1);
            st[k] = new int[m - (1 << k) + 1];
            for (int i = 0; i < st[k].length; i++) {
                st[k][i] = Math.min(st[k - 1][i], st[k - 1][i + half]);
            }
        }
    }

    public static LcpRangeQuery of(String s) {
        int[] sa = SuffixArrays.dc3(s);
        return new LcpRangeQuery(sa, SuffixArrays.lcp(s, sa));
    }

    /**
     * Minimum of {@code lcp[l..r]}, both ends inclusive.
     */
    public int rangeMin(int l, int r) {
        int m = st[0].length;
        if (l < 0 || r >= m || l > r) {
            throw AlgorithmException.invalidArgument("range [%d, %d] is outside the lcp array of length %d", l, r, m);
        }
        int k = log2[r - l + 1];
        return Math.min(st[k][l], st[k][r - (1 << k) + 1]);
    }

    /**
     * Length of the longest common prefix of the suffixes starting at {@code i} and {@code j}.
     */
    public int longestCommonPrefix(int i, int j) {
        if (i < 0 || i >= n || j < 0 || j >= n) {
            throw AlgorithmException.invalidArgument("suffix positions %d, %d outside [0, %d)", i, j, n);
        }
        if (i == j) {
            return n - i;
        }
        int a = Math.min(rank[i], rank[j]);
        int b = Math.max(rank[i], rank[j]);
        return rangeMin(a, b - 1);
    }
}
