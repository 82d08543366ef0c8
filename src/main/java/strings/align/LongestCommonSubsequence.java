package strings.align;

import utilities.AlgorithmException;

/**
 * Longest common subsequence of two strings.
 *
 * <p>{@link #dp(String, String)} keeps the whole table and traces back from the corner;
 * {@link #hirschberg(String, String)} keeps two rows at a time and recurses on halves.
 * Both return a longest subsequence, not necessarily the same one.</p>
 */
public final class LongestCommonSubsequence {

    private LongestCommonSubsequence() {
    }

    public static String dp(String s1, String s2) {
        check(s1, s2);
        final int n = s1.length();
        final int m = s2.length();
        int[][] dp = new int[n + 1][m + 1];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                if (s1.charAt(i) == s2.charAt(j)) {
                    dp[i + 1][j + 1] = dp[i][j] + 1;
                } else {
                    dp[i + 1][j + 1] = Math.max(dp[i + 1][j], dp[i][j + 1]);
                }
            }
        }
        StringBuilder sb = new StringBuilder(dp[n][m]);
        for (int i = n, j = m; i > 0 && j > 0; ) {
            if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                sb.append(s1.charAt(i - 1));
                i--;
                j--;
            } else if (dp[i - 1][j] < dp[i][j - 1]) {
                j--;
            } else {
                i--;
            }
        }
        return sb.reverse().toString();
    }

    public static int length(String s1, String s2) {
        check(s1, s2);
        int[] row = lengthRow(s1, 0, s1.length(), s2, 0, s2.length(), false);
        return row[s2.length()];
    }

    /**
     * Length of the shortest string having both inputs as subsequences.
     */
    public static int shortestCommonSupersequenceLength(String s1, String s2) {
        return s1.length() + s2.length() - length(s1, s2);
    }

    public static String hirschberg(String s1, String s2) {
        check(s1, s2);
        StringBuilder out = new StringBuilder();
        solve(s1, 0, s1.length(), s2, 0, s2.length(), out);
        return out.toString();
    }

    private static void solve(String a, int lo1, int hi1, String b, int lo2, int hi2, StringBuilder out) {
        if (lo1 == hi1 || lo2 == hi2) {
            return;
        }
        if (lo1 + 1 == hi1) {
            char c = a.charAt(lo1);
            for (int j = lo2; j < hi2; j++) {
                if (b.charAt(j) == c) {
                    out.append(c);
                    return;
                }
            }
            return;
        }
        int mid = lo1 + (hi1 - lo1) / 2;
        int[] fwd = lengthRow(a, lo1, mid, b, lo2, hi2, false);
        int[] rev = lengthRow(a, mid, hi1, b, lo2, hi2, true);
        int m = hi2 - lo2;
        int split = 0;
        int best = -1;
        for (int k = 0; k <= m; k++) {
            if (fwd[k] + rev[m - k] > best) {
                best = fwd[k] + rev[m - k];
                split = k;
            }
        }
        solve(a, lo1, mid, b, lo2, lo2 + split, out);
        solve(a, mid, hi1, b, lo2 + split, hi2, out);
    }

    /**
     * LCS lengths of {@code a[lo1..hi1)} against every prefix of {@code b[lo2..hi2)}, or with
     * {@code reversed} set, of both ranges read backwards.
     */
    private static int[] lengthRow(String a, int lo1, int hi1, String b, int lo2, int hi2, boolean reversed) {
        final int m = hi2 - lo2;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int step = 0; step < hi1 - lo1; step++) {
            char c = reversed ? a.charAt(hi1 - 1 - step) : a.charAt(lo1 + step);
            for (int j = 0; j < m; j++) {
                char d = reversed ? b.charAt(hi2 - 1 - j) : b.charAt(lo2 + j);
                cur[j + 1] = c == d ? prev[j] + 1 : Math.max(prev[j + 1], cur[j]);
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev;
    }

    private static void check(String s1, String s2) {
        if (s1 == null || s2 == null) {
            throw AlgorithmException.invalidArgument("strings must be non-null");
        }
    }
}
