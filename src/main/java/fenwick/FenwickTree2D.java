package fenwick;

import utilities.AlgorithmException;

/**
 * Two-level binary indexed tree with point update and rectangle sum over a
 * {@code rows x cols} grid. Indices are 0-based.
 */
public final class FenwickTree2D {

    private final int rows;
    private final int cols;
    private final long[][] tree;

    public FenwickTree2D(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw AlgorithmException.invalidArgument("dimensions must be non-negative, got %dx%d", rows, cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.tree = new long[rows + 1][cols + 1];
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public void add(int r, int c, long x) {
        checkCell(r, c);
        for (int i = r + 1; i <= rows; i += i & -i) {
            for (int j = c + 1; j <= cols; j += j & -j) {
                tree[i][j] += x;
            }
        }
    }

    public void set(int r, int c, long x) {
        add(r, c, x - at(r, c));
    }

    public long at(int r, int c) {
        return sum(r, c, r, c);
    }

    /**
     * Sum over the rectangle from {@code (0, 0)} to {@code (r, c)} inclusive; zero when
     * either coordinate is -1.
     */
    public long sum(int r, int c) {
        if (r < -1 || r >= rows || c < -1 || c >= cols) {
            throw AlgorithmException.invalidArgument("corner (%d, %d) outside the %dx%d grid", r, c, rows, cols);
        }
        long s = 0L;
        for (int i = r + 1; i > 0; i -= i & -i) {
            for (int j = c + 1; j > 0; j -= j & -j) {
                s += tree[i][j];
            }
        }
        return s;
    }

    /**
     * Sum over the rectangle with corners {@code (r1, c1)} and {@code (r2, c2)} inclusive;
     * zero if the rectangle is empty.
     */
    public long sum(int r1, int c1, int r2, int c2) {
        if (r1 > r2 || c1 > c2) {
            return 0L;
        }
        checkCell(r1, c1);
        return sum(r2, c2) - sum(r1 - 1, c2) - sum(r2, c1 - 1) + sum(r1 - 1, c1 - 1);
    }

    private void checkCell(int r, int c) {
        if (r < 0 || r >= rows || c < 0 || c >= cols) {
            throw AlgorithmException.invalidArgument("cell (%d, %d) outside the %dx%d grid", r, c, rows, cols);
        }
    }
}
