package fenwick;

/**
 * Array-backed rectangle-update, rectangle-sum tree; four {@code (rows + 1) x (cols + 1)}
 * arrays.
 */
public final class RangeFenwickTree2D extends AbstractRangeFenwickTree2D {

    private final long[][][] cells;

    public RangeFenwickTree2D(int rows, int cols) {
        super(rows, cols);
        this.cells = new long[4][rows + 1][cols + 1];
    }

    @Override
    protected long cell(int tree, int i, int j) {
        return cells[tree][i][j];
    }

    @Override
    protected void addToCell(int tree, int i, int j, long x) {
        cells[tree][i][j] += x;
    }
}
