package fenwick;

import utilities.AlgorithmException;

/**
 * Rectangle update and rectangle sum over a {@code rows x cols} grid with four
 * point-update trees.
 *
 * <p>Adding {@code v} to every cell of the 1-based prefix rectangle {@code [1, x] x [1, y]}
 * contributes {@code v * min(i, x) * min(j, y)} to the prefix sum at {@code (i, j)}. That
 * product splits into the bilinear, the two linear and the constant terms, which are kept
 * in {@code T1..T4}, so that a prefix sum is
 * {@code S1 * i * j + S2 * i + S3 * j + S4}. A general rectangle update is four signed
 * prefix updates.</p>
 */
public abstract class AbstractRangeFenwickTree2D {

    protected static final int T1 = 0;
    protected static final int T2 = 1;
    protected static final int T3 = 2;
    protected static final int T4 = 3;

    private final int rows;
    private final int cols;

    protected AbstractRangeFenwickTree2D(int rows, int cols) {
        if (rows < 0 || cols < 0 || rows == Integer.MAX_VALUE || cols == Integer.MAX_VALUE) {
            throw AlgorithmException.invalidArgument("dimensions must lie in [0, %d), got %dx%d",
                    Integer.MAX_VALUE, rows, cols);
        }
        this.rows = rows;
        this.cols = cols;
    }

    protected abstract long cell(int tree, int i, int j);

    protected abstract void addToCell(int tree, int i, int j, long x);

    public final int rows() {
        return rows;
    }

    public final int cols() {
        return cols;
    }

    /**
     * Adds {@code x} to every cell of the rectangle with corners {@code (r1, c1)} and
     * {@code (r2, c2)} inclusive.
     */
    public final void add(int r1, int c1, int r2, int c2, long x) {
        checkCell(r1, c1);
        checkCell(r2, c2);
        if (r1 > r2 || c1 > c2) {
            throw AlgorithmException.invalidArgument("empty rectangle (%d, %d)-(%d, %d)", r1, c1, r2, c2);
        }
        addPrefix(r2 + 1, c2 + 1, x);
        addPrefix(r1, c2 + 1, -x);
        addPrefix(r2 + 1, c1, -x);
        addPrefix(r1, c1, x);
    }

    public final void add(int r, int c, long x) {
        add(r, c, r, c, x);
    }

    public final void set(int r, int c, long x) {
        add(r, c, x - at(r, c));
    }

    public final long at(int r, int c) {
        return sum(r, c, r, c);
    }

    /**
     * Sum over the rectangle from {@code (0, 0)} to {@code (r, c)}; zero when either
     * coordinate is -1.
     */
    public final long sum(int r, int c) {
        if (r < -1 || r >= rows || c < -1 || c >= cols) {
            throw AlgorithmException.invalidArgument("corner (%d, %d) outside the %dx%d grid", r, c, rows, cols);
        }
        long x = r + 1;
        long y = c + 1;
        long s1 = 0L;
        long s2 = 0L;
        long s3 = 0L;
        long s4 = 0L;
        for (int i = r + 1; i > 0; i -= i & -i) {
            for (int j = c + 1; j > 0; j -= j & -j) {
                s1 += cell(T1, i, j);
                s2 += cell(T2, i, j);
                s3 += cell(T3, i, j);
                s4 += cell(T4, i, j);
            }
        }
        return s1 * x * y + s2 * x + s3 * y + s4;
    }

    public final long sum(int r1, int c1, int r2, int c2) {
        if (r1 > r2 || c1 > c2) {
            return 0L;
        }
        checkCell(r1, c1);
        return sum(r2, c2) - sum(r1 - 1, c2) - sum(r2, c1 - 1) + sum(r1 - 1, c1 - 1);
    }

    // Adds v to the 1-based prefix rectangle [1, x] x [1, y]; zero extent is a no-op.
    private void addPrefix(int x, int y, long v) {
        if (x == 0 || y == 0) {
            return;
        }
        update(T1, 1, 1, v);
        update(T1, 1, y + 1, -v);
        update(T2, 1, y + 1, v * y);
        update(T1, x + 1, 1, -v);
        update(T3, x + 1, 1, v * x);
        update(T1, x + 1, y + 1, v);
        update(T2, x + 1, y + 1, -v * y);
        update(T3, x + 1, y + 1, -v * x);
        update(T4, x + 1, y + 1, v * x * y);
    }

    private void update(int tree, int r, int c, long x) {
        // Cells beyond the grid never take part in a prefix sum.
        for (long i = r; i <= rows; i += i & -i) {
            for (long j = c; j <= cols; j += j & -j) {
                addToCell(tree, (int) i, (int) j, x);
            }
        }
    }

    private void checkCell(int r, int c) {
        if (r < 0 || r >= rows || c < 0 || c >= cols) {
            throw AlgorithmException.invalidArgument("cell (%d, %d) outside the %dx%d grid", r, c, rows, cols);
        }
    }
}
