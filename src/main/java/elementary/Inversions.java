package elementary;

import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Inversion count of an array: the number of pairs {@code i < j} with {@code a[i] > a[j]}.
 */
public final class Inversions {

    private Inversions() {
    }

    /**
     * Merge-sort count in {@code O(n log n)}. The input is left untouched.
     */
    public static long count(int[] a) {
        if (a == null) {
            throw AlgorithmException.invalidArgument("array must be non-null");
        }
        int[] work = a.clone();
        int[] buffer = new int[work.length];
        long inversions = 0L;
        for (int width = 1; width < work.length; width <<= 1) {
            for (int lo = 0; lo + width < work.length; lo += width << 1) {
                int mid = lo + width;
                int hi = Math.min(lo + (width << 1), work.length);
                inversions += merge(work, buffer, lo, mid, hi);
            }
        }
        return inversions;
    }

    // Merges the sorted runs [lo, mid) and [mid, hi), counting pairs split across them.
    private static long merge(int[] a, int[] buffer, int lo, int mid, int hi) {
        long inversions = 0L;
        int i = lo;
        int j = mid;
        int k = lo;
        while (i < mid && j < hi) {
            if (a[j] < a[i]) {
                inversions += mid - i;
                buffer[k++] = a[j++];
            } else {
                buffer[k++] = a[i++];
            }
        }
        while (i < mid) {
            buffer[k++] = a[i++];
        }
        while (j < hi) {
            buffer[k++] = a[j++];
        }
        System.arraycopy(buffer, lo, a, lo, hi - lo);
        return inversions;
    }

    /**
     * Bit-by-bit count for non-negative values in {@code O(n log m)} time and {@code O(m)}
     * space, {@code m} being the largest value. Each round compares values that agree on
     * all bits above the current one: an odd value (bit set) seen before an even value
     * with the same prefix is an inversion.
     *
     * <p><b>Destructive:</b> every element of {@code a} is zero on return. Use
     * {@link #count(int[])} to keep the input.</p>
     */
    public static long countDestructive(int[] a) {
        if (a == null) {
            throw AlgorithmException.invalidArgument("array must be non-null");
        }
        int max = 0;
        for (int i = 0; i < a.length; i++) {
            if (a[i] < 0) {
                throw AlgorithmException.invalidArgument("value at %d is negative: %d", i, a[i]);
            }
            max = Math.max(max, a[i]);
        }
        long inversions = 0L;
        int[] count = new int[max];
        while (max > 0) {
            Arrays.fill(count, 0);
            for (int v : a) {
                if ((v & 1) == 0) {
                    inversions += count[v >> 1];
                } else {
                    count[v >> 1]++;
                }
            }
            max = 0;
            for (int i = 0; i < a.length; i++) {
                a[i] >>= 1;
                max = Math.max(max, a[i]);
            }
        }
        return inversions;
    }
}
