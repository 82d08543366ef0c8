package strings.suffix;

import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Suffix array and LCP array construction.
 *
 * <p>Two builders produce the same permutation:</p>
 * <ul>
 *   <li>{@link #doubling(int[])} - prefix doubling, each round a counting sort on
 *       {@code (rank[i], rank[i + k])}; {@code O(n log n)}.</li>
 *   <li>{@link #dc3(int[])} - the Karkkainen-Sanders skew algorithm; {@code O(n)}.</li>
 * </ul>
 *
 * <p>{@link #lcp(int[], int[])} is Kasai's linear algorithm. {@code lcp[i]} is the length of the
 * longest common prefix of the suffixes at {@code sa[i]} and {@code sa[i + 1]}, so the result has
 * {@code n - 1} entries.</p>
 *
 * <p>Symbols may be any ints; {@code String} overloads use the chars. Every call allocates its
 * own scratch arrays.</p>
 */
public final class SuffixArrays {

    private SuffixArrays() {
    }

    public static int[] doubling(String s) {
        return doubling(symbols(s));
    }

    public static int[] dc3(String s) {
        return dc3(symbols(s));
    }

    public static int[] lcp(String s, int[] sa) {
        return lcp(symbols(s), sa);
    }

    public static int[] doubling(int[] text) {
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        final int n = text.length;
        if (n == 0) {
            return new int[0];
        }

        int[] rank = new int[n];
        int classes = SymbolRanks.rankTransform(text, rank);
        int[] sa = new int[n];
        int[] tmp = new int[n];
        int[] count = new int[Math.max(classes, n) + 1];

        // Round 0: order by single symbol.
        for (int i = 0; i < n; i++) {
            count[rank[i]]++;
        }
        for (int c = 1; c < classes; c++) {
            count[c] += count[c - 1];
        }
        for (int i = n - 1; i >= 0; i--) {
            sa[--count[rank[i]]] = i;
        }

        int[] next = new int[n];
        for (int k = 1; classes < n; k <<= 1) {
            // Order by the second key: suffixes too short for a second half come first.
            int p = 0;
            for (int i = n - k; i < n; i++) {
                if (i >= 0) {
                    tmp[p++] = i;
                }
            }
            for (int i = 0; i < n; i++) {
                if (sa[i] >= k) {
                    tmp[p++] = sa[i] - k;
                }
            }

            // Stable counting sort by the first key.
            Arrays.fill(count, 0, classes + 1, 0);
            for (int i = 0; i < n; i++) {
                count[rank[i]]++;
            }
            for (int c = 1; c < classes; c++) {
                count[c] += count[c - 1];
            }
            for (int i = n - 1; i >= 0; i--) {
                sa[--count[rank[tmp[i]]]] = tmp[i];
            }

            // Re-rank: bump only when the pair strictly increases.
            next[sa[0]] = 0;
            classes = 1;
            for (int i = 1; i < n; i++) {
                int prev = sa[i - 1];
                int cur = sa[i];
                if (rank[prev] != rank[cur] || secondKey(rank, prev, k) != secondKey(rank, cur, k)) {
                    classes++;
                }
                next[cur] = classes - 1;
            }
            int[] swap = rank;
            rank = next;
            next = swap;
        }
        return sa;
    }

    private static int secondKey(int[] rank, int i, int k) {
        return i + k < rank.length ? rank[i + k] : -1;
    }

    public static int[] dc3(int[] text) {
        if (text == null) {
            throw AlgorithmException.invalidArgument("text must be non-null");
        }
        final int n = text.length;
        if (n == 0) {
            return new int[0];
        }
        // Skew needs symbols in [1, K] and three zero pads so s[i + 2] is always readable.
        int[] s = new int[n + 3];
        int alphabet = SymbolRanks.rankTransform(text, s);
        for (int i = 0; i < n; i++) {
            s[i]++;
        }
        s[n] = s[n + 1] = s[n + 2] = 0;
        return skew(s, n, alphabet);
    }

    /**
     * Skew / DC3 on {@code s[0..n)} with symbols in {@code [1, alphabet]} and
     * {@code s[n..n+2] == 0}.
     *
     * <ol>
     *   <li>radix sort the triples starting at positions {@code i % 3 != 0}</li>
     *   <li>name them; recurse on the names if two triples collide</li>
     *   <li>sort the mod-0 suffixes by first symbol and the rank of the suffix after it</li>
     *   <li>merge the two sorted lists with a constant-time comparison</li>
     * </ol>
     */
    private static int[] skew(int[] s, int n, int alphabet) {
        if (n == 1) {
            return new int[]{0};
        }
        final int n0 = (n + 2) / 3;
        final int n1 = (n + 1) / 3;
        final int n2 = n / 3;
        // When n % 3 == 1 a dummy mod-1 position n is added; its triple (0, 0, 0) sorts first
        // and keeps the mod-1 and mod-2 halves of the recursive string apart.
        final int n02 = n0 + n2;

        int[] sample = new int[n02];
        int[] sa12 = new int[n02];
        for (int i = 0, j = 0; i < n + (n0 - n1); i++) {
            if (i % 3 != 0) {
                sample[j++] = i;
            }
        }
        radixPass(sample, sa12, s, 2, n02, alphabet);
        radixPass(sa12, sample, s, 1, n02, alphabet);
        radixPass(sample, sa12, s, 0, n02, alphabet);

        int[] names = new int[n02 + 3];
        int name = 0;
        int prev0 = -1;
        int prev1 = -1;
        int prev2 = -1;
        for (int i = 0; i < n02; i++) {
            int pos = sa12[i];
            if (s[pos] != prev0 || s[pos + 1] != prev1 || s[pos + 2] != prev2) {
                name++;
                prev0 = s[pos];
                prev1 = s[pos + 1];
                prev2 = s[pos + 2];
            }
            if (pos % 3 == 1) {
                names[pos / 3] = name;
            } else {
                names[pos / 3 + n0] = name;
            }
        }

        if (name < n02) {
            int[] recursive = skew(names, n02, name);
            for (int i = 0; i < n02; i++) {
                sa12[i] = recursive[i] < n0 ? recursive[i] * 3 + 1 : (recursive[i] - n0) * 3 + 2;
            }
        }

        // rank12[pos] is the 1-based rank of a sampled suffix; 0 past the end.
        int[] rank12 = new int[n + 3];
        for (int i = 0; i < n02; i++) {
            rank12[sa12[i]] = i + 1;
        }

        // Mod-0 suffixes come out ordered by the rank of the suffix that follows them;
        // one stable pass on the first symbol finishes the sort.
        int[] mod0 = new int[n0];
        int[] sa0 = new int[n0];
        for (int i = 0, j = 0; i < n02; i++) {
            if (sa12[i] % 3 == 1) {
                mod0[j++] = sa12[i] - 1;
            }
        }
        radixPass(mod0, sa0, s, 0, n0, alphabet);

        int[] sa = new int[n];
        int t = 0;
        int p = 0;
        int k = 0;
        while (t < n02 && p < n0) {
            int i = sa12[t];
            if (i >= n) {
                t++;
                continue;
            }
            int j = sa0[p];
            if (suffixLessOrEqual(i, j, s, rank12)) {
                sa[k++] = i;
                t++;
            } else {
                sa[k++] = j;
                p++;
            }
        }
        while (p < n0) {
            sa[k++] = sa0[p++];
        }
        while (t < n02) {
            if (sa12[t] < n) {
                sa[k++] = sa12[t];
            }
            t++;
        }
        return sa;
    }

    /**
     * Compares a sampled suffix {@code left} with a mod-0 suffix {@code right} using one or two
     * symbols and then the precomputed ranks.
     */
    private static boolean suffixLessOrEqual(int left, int right, int[] s, int[] rank12) {
        if (s[left] != s[right]) {
            return s[left] < s[right];
        }
        if (left % 3 == 1) {
            return rank12[left + 1] <= rank12[right + 1];
        }
        if (s[left + 1] != s[right + 1]) {
            return s[left + 1] < s[right + 1];
        }
        return rank12[left + 2] <= rank12[right + 2];
    }

    /**
     * Stable counting sort of {@code source} into {@code dest} by {@code s[index + offset]}.
     */
    private static void radixPass(int[] source, int[] dest, int[] s, int offset, int length, int alphabet) {
        int[] count = new int[alphabet + 2];
        for (int i = 0; i < length; i++) {
            count[s[source[i] + offset] + 1]++;
        }
        for (int i = 1; i < count.length; i++) {
            count[i] += count[i - 1];
        }
        for (int i = 0; i < length; i++) {
            int idx = source[i];
            dest[count[s[idx + offset]]++] = idx;
        }
    }

    /**
     * Kasai's algorithm: walks the text in position order and reuses the previous LCP minus one.
     */
    public static int[] lcp(int[] text, int[] sa) {
        if (text == null || sa == null) {
            throw AlgorithmException.invalidArgument("text and suffix array must be non-null");
        }
        final int n = text.length;
        if (sa.length != n) {
            throw AlgorithmException.invalidArgument("suffix array has %d entries for a text of length %d", sa.length, n);
        }
        if (n == 0) {
            return new int[0];
        }

        int[] rank = new int[n];
        for (int i = 0; i < n; i++) {
            rank[sa[i]] = i;
        }

        int[] lcp = new int[n - 1];
        int h = 0;
        for (int i = 0; i < n; i++) {
            int r = rank[i];
            if (r == n - 1) {
                h = 0;
                continue;
            }
            int j = sa[r + 1];
            while (i + h < n && j + h < n && text[i + h] == text[j + h]) {
                h++;
            }
            lcp[r] = h;
            if (h > 0) {
                h--;
            }
        }
        return lcp;
    }

    static int[] symbols(String s) {
        if (s == null) {
            throw AlgorithmException.invalidArgument("string must be non-null");
        }
        return s.chars().toArray();
    }
}
