package fenwick;

/**
 * Array-backed range-update, range-sum tree of a fixed size.
 */
public final class RangeFenwickTree extends AbstractRangeFenwickTree {

    private final long[][] cells;

    public RangeFenwickTree(int size) {
        super(size);
        this.cells = new long[2][size + 1];
    }

    @Override
    protected long cell(int tree, long i) {
        return cells[tree][(int) i];
    }

    @Override
    protected void addToCell(int tree, long i, long x) {
        cells[tree][(int) i] += x;
    }
}
