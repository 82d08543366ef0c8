package fenwick;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;

/**
 * Rectangle-update, rectangle-sum tree over a sparse grid of up to
 * {@code Integer.MAX_VALUE - 1} rows and columns. A cell {@code (i, j)} is keyed by
 * {@code i << 32 | j} in one hash map per tree.
 */
public final class CompressedFenwickTree2D extends AbstractRangeFenwickTree2D {

    private final Long2LongOpenHashMap[] cells = new Long2LongOpenHashMap[4];

    public CompressedFenwickTree2D(int rows, int cols) {
        super(rows, cols);
        for (int t = 0; t < cells.length; t++) {
            cells[t] = new Long2LongOpenHashMap();
        }
    }

    private static long key(int i, int j) {
        return ((long) i << 32) | (j & 0xFFFFFFFFL);
    }

    @Override
    protected long cell(int tree, int i, int j) {
        return cells[tree].get(key(i, j));
    }

    @Override
    protected void addToCell(int tree, int i, int j, long x) {
        Long2LongOpenHashMap map = cells[tree];
        long k = key(i, j);
        if (map.addTo(k, x) + x == 0L) {
            map.remove(k);
        }
    }

    public int cellCount() {
        int total = 0;
        for (Long2LongOpenHashMap map : cells) {
            total += map.size();
        }
        return total;
    }
}
