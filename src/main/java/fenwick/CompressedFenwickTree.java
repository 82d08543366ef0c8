package fenwick;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import utilities.AlgorithmException;

/**
 * Range-update, range-sum tree over a huge index space whose cells live in hash maps.
 * Only cells on the update paths are ever stored, so memory grows with
 * {@code O(updates * log capacity)} rather than with the capacity.
 */
public final class CompressedFenwickTree extends AbstractRangeFenwickTree {

    public static final long MAX_CAPACITY = 1L << 62;

    private final Long2LongOpenHashMap[] cells = {new Long2LongOpenHashMap(), new Long2LongOpenHashMap()};

    /**
     * @param capacity number of addressable indices, at most {@code 2^62}
     */
    public CompressedFenwickTree(long capacity) {
        super(checkCapacity(capacity));
    }

    private static long checkCapacity(long capacity) {
        if (capacity < 0 || capacity > MAX_CAPACITY) {
            throw AlgorithmException.invalidArgument("capacity must lie in [0, 2^62], got %d", capacity);
        }
        return capacity;
    }

    @Override
    protected long cell(int tree, long i) {
        return cells[tree].get(i);
    }

    @Override
    protected void addToCell(int tree, long i, long x) {
        Long2LongOpenHashMap map = cells[tree];
        if (map.addTo(i, x) + x == 0L) {
            map.remove(i);
        }
    }

    /**
     * Number of non-zero cells currently stored.
     */
    public int cellCount() {
        return cells[T1].size() + cells[T2].size();
    }
}
