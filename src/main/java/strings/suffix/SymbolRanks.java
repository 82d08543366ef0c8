package strings.suffix;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.Arrays;

/**
 * Maps arbitrary int symbols onto a dense alphabet {@code 0..distinct-1} that preserves order,
 * so the counting sorts of the suffix-array builders index small arrays.
 */
final class SymbolRanks {

    private static final int RADIX = 256;

    private SymbolRanks() {
    }

    /**
     * Stable LSD radix sort, 8 bits per pass. The sign bit is flipped so negative values
     * sort before positive ones as unsigned keys.
     */
    static void sortInPlace(int[] values) {
        if (values.length <= 1) {
            return;
        }
        int[] buffer = new int[values.length];
        int[] count = new int[RADIX];
        for (int shift = 0; shift < Integer.SIZE; shift += 8) {
            Arrays.fill(count, 0);
            for (int value : values) {
                count[((value ^ Integer.MIN_VALUE) >>> shift) & 0xFF]++;
            }
            for (int i = 1; i < RADIX; i++) {
                count[i] += count[i - 1];
            }
            for (int i = values.length - 1; i >= 0; i--) {
                buffer[--count[((values[i] ^ Integer.MIN_VALUE) >>> shift) & 0xFF]] = values[i];
            }
            System.arraycopy(buffer, 0, values, 0, values.length);
        }
    }

    /**
     * Equal symbols get equal ranks and {@code a < b} implies {@code rank(a) < rank(b)}.
     *
     * @param ranks output, same length as {@code values}
     * @return the number of distinct symbols
     */
    static int rankTransform(int[] values, int[] ranks) {
        int[] sorted = Arrays.copyOf(values, values.length);
        sortInPlace(sorted);
        Int2IntOpenHashMap rankOf = new Int2IntOpenHashMap(values.length);
        int next = 0;
        for (int i = 0; i < sorted.length; i++) {
            if (i == 0 || sorted[i] != sorted[i - 1]) {
                rankOf.put(sorted[i], next++);
            }
        }
        for (int i = 0; i < values.length; i++) {
            ranks[i] = rankOf.get(values[i]);
        }
        return next;
    }
}
