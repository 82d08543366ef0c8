package strings.align;

import utilities.AlgorithmException;

/**
 * Minimum-cost global alignment of two strings under a gap cost and a substitution cost.
 *
 * <p>{@link #align(String, String, int, int)} fills the full {@code (n+1) x (m+1)} table and
 * traces back from the corner. {@link #hirschberg(String, String, int, int)} returns an
 * alignment of the same cost in linear space: it splits the first string in half, computes
 * one forward and one reverse row of the table against the second string, cuts the second
 * string where the two rows sum to the minimum and recurses on both halves.</p>
 *
 * <p>With both costs equal to 1 the cost is the Levenshtein distance.</p>
 */
public final class SequenceAlignment {

    private SequenceAlignment() {
    }

    public static Alignment align(String s1, String s2, int gapCost, int subCost) {
        checkArguments(s1, s2, gapCost, subCost);
        final int n = s1.length();
        final int m = s2.length();
        long[][] dp = new long[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            dp[i][0] = (long) i * gapCost;
        }
        for (int j = 0; j <= m; j++) {
            dp[0][j] = (long) j * gapCost;
        }
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                long diagonal = dp[i - 1][j - 1] + (s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : subCost);
                dp[i][j] = Math.min(diagonal, Math.min(dp[i - 1][j], dp[i][j - 1]) + gapCost);
            }
        }

        StringBuilder r1 = new StringBuilder(n + m);
        StringBuilder r2 = new StringBuilder(n + m);
        int i = n;
        int j = m;
        while (i > 0 && j > 0) {
            if (s1.charAt(i - 1) == s2.charAt(j - 1) || dp[i][j] == dp[i - 1][j - 1] + subCost) {
                r1.append(s1.charAt(--i));
                r2.append(s2.charAt(--j));
            } else if (dp[i][j] == dp[i - 1][j] + gapCost) {
                r1.append(s1.charAt(--i));
                r2.append(Alignment.GAP);
            } else {
                r1.append(Alignment.GAP);
                r2.append(s2.charAt(--j));
            }
        }
        while (i > 0 || j > 0) {
            r1.append(i > 0 ? s1.charAt(--i) : Alignment.GAP);
            r2.append(j > 0 ? s2.charAt(--j) : Alignment.GAP);
        }
        return new Alignment(r1.reverse().toString(), r2.reverse().toString());
    }

    public static long cost(String s1, String s2, int gapCost, int subCost) {
        checkArguments(s1, s2, gapCost, subCost);
        long[] row = forwardRow(s1, 0, s1.length(), s2, 0, s2.length(), gapCost, subCost);
        return row[s2.length()];
    }

    public static Alignment hirschberg(String s1, String s2, int gapCost, int subCost) {
        checkArguments(s1, s2, gapCost, subCost);
        // Rows run over the second string, so keep it the shorter one.
        if (s1.length() < s2.length()) {
            return hirschberg(s2, s1, gapCost, subCost).swapped();
        }
        StringBuilder r1 = new StringBuilder();
        StringBuilder r2 = new StringBuilder();
        new Hirschberg(s1, s2, gapCost, subCost, r1, r2).solve(0, s1.length(), 0, s2.length());
        return new Alignment(r1.toString(), r2.toString());
    }

    /**
     * Last row of the alignment table of {@code a[lo1..hi1)} against {@code b[lo2..hi2)}.
     */
    static long[] forwardRow(String a, int lo1, int hi1, String b, int lo2, int hi2, int gapCost, int subCost) {
        final int m = hi2 - lo2;
        long[] prev = new long[m + 1];
        long[] cur = new long[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = (long) j * gapCost;
        }
        for (int i = lo1; i < hi1; i++) {
            cur[0] = prev[0] + gapCost;
            char c = a.charAt(i);
            for (int j = 0; j < m; j++) {
                long diagonal = prev[j] + (c == b.charAt(lo2 + j) ? 0 : subCost);
                cur[j + 1] = Math.min(diagonal, Math.min(prev[j + 1], cur[j]) + gapCost);
            }
            long[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    /**
     * Same as {@link #forwardRow} on both ranges read backwards.
     */
    static long[] reverseRow(String a, int lo1, int hi1, String b, int lo2, int hi2, int gapCost, int subCost) {
        final int m = hi2 - lo2;
        long[] prev = new long[m + 1];
        long[] cur = new long[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = (long) j * gapCost;
        }
        for (int i = hi1 - 1; i >= lo1; i--) {
            cur[0] = prev[0] + gapCost;
            char c = a.charAt(i);
            for (int j = 0; j < m; j++) {
                long diagonal = prev[j] + (c == b.charAt(hi2 - 1 - j) ? 0 : subCost);
                cur[j + 1] = Math.min(diagonal, Math.min(prev[j + 1], cur[j]) + gapCost);
            }
            long[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    private static final class Hirschberg {
        private final String s1;
        private final String s2;
        private final int gapCost;
        private final int subCost;
        private final StringBuilder r1;
        private final StringBuilder r2;

        Hirschberg(String s1, String s2, int gapCost, int subCost, StringBuilder r1, StringBuilder r2) {
            this.s1 = s1;
            this.s2 = s2;
            this.gapCost = gapCost;
            this.subCost = subCost;
            this.r1 = r1;
            this.r2 = r2;
        }

        void solve(int lo1, int hi1, int lo2, int hi2) {
            if (lo1 == hi1) {
                for (int j = lo2; j < hi2; j++) {
                    r1.append(Alignment.GAP);
                    r2.append(s2.charAt(j));
                }
                return;
            }
            if (lo1 + 1 == hi1) {
                alignSingle(s1.charAt(lo1), lo2, hi2);
                return;
            }

            int mid1 = lo1 + (hi1 - lo1) / 2;
            long[] fwd = forwardRow(s1, lo1, mid1, s2, lo2, hi2, gapCost, subCost);
            long[] rev = reverseRow(s1, mid1, hi1, s2, lo2, hi2, gapCost, subCost);
            int m = hi2 - lo2;
            int split = 0;
            long best = Long.MAX_VALUE;
            for (int k = 0; k <= m; k++) {
                long total = fwd[k] + rev[m - k];
                if (total < best) {
                    best = total;
                    split = k;
                }
            }
            solve(lo1, mid1, lo2, lo2 + split);
            solve(mid1, hi1, lo2 + split, hi2);
        }

        /**
         * One character against a range: match it where it occurs, otherwise substitute it
         * for the first character unless two gaps are cheaper than a substitution.
         */
        private void alignSingle(char c, int lo2, int hi2) {
            int pos = -1;
            for (int j = lo2; j < hi2; j++) {
                if (s2.charAt(j) == c) {
                    pos = j;
                    break;
                }
            }
            boolean insert = hi2 == lo2 || (pos == -1 && 2L * gapCost < subCost);
            if (insert) {
                r1.append(c);
                r2.append(Alignment.GAP);
            }
            int place = insert ? -1 : (pos == -1 ? lo2 : pos);
            for (int j = lo2; j < hi2; j++) {
                r1.append(j == place ? c : Alignment.GAP);
                r2.append(s2.charAt(j));
            }
        }
    }

    private static void checkArguments(String s1, String s2, int gapCost, int subCost) {
        if (s1 == null || s2 == null) {
            throw AlgorithmException.invalidArgument("strings must be non-null");
        }
        if (s1.indexOf(Alignment.GAP) >= 0 || s2.indexOf(Alignment.GAP) >= 0) {
            throw AlgorithmException.invalidArgument("inputs must not contain the gap character '%c'", Alignment.GAP);
        }
        if (gapCost < 0 || subCost < 0) {
            throw AlgorithmException.invalidArgument("costs must be non-negative, got gap=%d sub=%d", gapCost, subCost);
        }
    }
}
