package strings.align;

import utilities.AlgorithmException;

/**
 * Levenshtein distance with two rolling rows.
 */
public final class EditDistance {

    private EditDistance() {
    }

    public static int levenshtein(String s1, String s2) {
        if (s1 == null || s2 == null) {
            throw AlgorithmException.invalidArgument("strings must be non-null");
        }
        final int m = s2.length();
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= m; j++) {
                int substitution = prev[j - 1] + (s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1);
                cur[j] = Math.min(substitution, Math.min(prev[j], cur[j - 1]) + 1);
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
        }
        return prev[m];
    }
}
