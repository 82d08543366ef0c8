package fenwick;

import utilities.AlgorithmException;

/**
 * Binary indexed tree over {@code long} values with point update and range sum.
 *
 * <p>Indices are 0-based; cell {@code i + 1} of the backing array holds index {@code i}.
 * Arithmetic wraps like plain {@code long} addition, so a sum is exact whenever the true
 * value fits in a {@code long}, whatever the intermediate cells hold.</p>
 */
public final class FenwickTree {

    private final long[] tree;

    public FenwickTree(int size) {
        if (size < 0) {
            throw AlgorithmException.invalidArgument("size must be non-negative, got %d", size);
        }
        this.tree = new long[size + 1];
    }

    /**
     * Builds the tree over {@code values} in linear time.
     */
    public FenwickTree(long[] values) {
        this(values.length);
        final int n = values.length;
        for (int i = 1; i <= n; i++) {
            tree[i] += values[i - 1];
            int parent = i + (i & -i);
            if (parent <= n) {
                tree[parent] += tree[i];
            }
        }
    }

    public int size() {
        return tree.length - 1;
    }

    public void add(int i, long x) {
        checkIndex(i);
        for (int j = i + 1; j < tree.length; j += j & -j) {
            tree[j] += x;
        }
    }

    public void set(int i, long x) {
        add(i, x - at(i));
    }

    public long at(int i) {
        return sum(i, i);
    }

    /**
     * Sum of indices {@code [0, hi]}; zero when {@code hi} is -1.
     */
    public long sum(int hi) {
        if (hi < -1 || hi >= size()) {
            throw AlgorithmException.invalidArgument("prefix end %d outside [-1, %d)", hi, size());
        }
        long s = 0L;
        for (int j = hi + 1; j > 0; j -= j & -j) {
            s += tree[j];
        }
        return s;
    }

    /**
     * Sum of indices {@code [lo, hi]}; zero when {@code lo > hi}.
     */
    public long sum(int lo, int hi) {
        if (lo > hi) {
            return 0L;
        }
        checkIndex(lo);
        return sum(hi) - sum(lo - 1);
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= size()) {
            throw AlgorithmException.invalidArgument("index %d outside [0, %d)", i, size());
        }
    }
}
