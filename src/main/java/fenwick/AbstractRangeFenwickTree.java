package fenwick;

import utilities.AlgorithmException;

/**
 * Range update and range sum through two point-update trees {@code T1} and {@code T2}.
 *
 * <p>With 1-based cells, the prefix sum up to cell {@code i} equals
 * {@code i * prefix(T1, i) - prefix(T2, i)}. Adding {@code x} to cells {@code [l, r]}
 * adds {@code x} to {@code T1[l]}, {@code -x} to {@code T1[r + 1]}, {@code x(l - 1)} to
 * {@code T2[l]} and {@code -x r} to {@code T2[r + 1]}. Subclasses decide how cells are
 * stored.</p>
 *
 * <p>Public indices are 0-based in {@code [0, size())}.</p>
 */
public abstract class AbstractRangeFenwickTree {

    protected static final int T1 = 0;
    protected static final int T2 = 1;

    private final long size;

    protected AbstractRangeFenwickTree(long size) {
        if (size < 0) {
            throw AlgorithmException.invalidArgument("size must be non-negative, got %d", size);
        }
        this.size = size;
    }

    /**
     * Value of a 1-based cell of tree {@code T1} or {@code T2}.
     */
    protected abstract long cell(int tree, long i);

    protected abstract void addToCell(int tree, long i, long x);

    public final long size() {
        return size;
    }

    /**
     * Adds {@code x} to every index in {@code [lo, hi]}.
     */
    public final void add(long lo, long hi, long x) {
        checkIndex(lo);
        checkIndex(hi);
        if (lo > hi) {
            throw AlgorithmException.invalidArgument("empty range [%d, %d]", lo, hi);
        }
        long l = lo + 1;
        long r = hi + 1;
        update(T1, l, x);
        update(T1, r + 1, -x);
        update(T2, l, x * (l - 1));
        update(T2, r + 1, -x * r);
    }

    public final void add(long i, long x) {
        add(i, i, x);
    }

    public final void set(long i, long x) {
        add(i, x - at(i));
    }

    public final long at(long i) {
        return sum(i, i);
    }

    /**
     * Sum of indices {@code [0, hi]}; zero when {@code hi} is -1.
     */
    public final long sum(long hi) {
        if (hi < -1 || hi >= size) {
            throw AlgorithmException.invalidArgument("prefix end %d outside [-1, %d)", hi, size);
        }
        long i = hi + 1;
        return i * prefix(T1, i) - prefix(T2, i);
    }

    public final long sum(long lo, long hi) {
        if (lo > hi) {
            return 0L;
        }
        checkIndex(lo);
        return sum(hi) - sum(lo - 1);
    }

    private void update(int tree, long i, long x) {
        // i + lowbit(i) turns negative past 2^62, which also ends the walk.
        for (; i > 0 && i <= size; i += i & -i) {
            addToCell(tree, i, x);
        }
    }

    private long prefix(int tree, long i) {
        long s = 0L;
        for (; i > 0; i -= i & -i) {
            s += cell(tree, i);
        }
        return s;
    }

    private void checkIndex(long i) {
        if (i < 0 || i >= size) {
            throw AlgorithmException.invalidArgument("index %d outside [0, %d)", i, size);
        }
    }
}
