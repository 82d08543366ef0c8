package fenwick;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FenwickTree2DTest {

    private static void fill(AbstractRangeFenwickTree2D tree) {
        tree.set(0, 0, 5);
        tree.set(0, 1, 6);
        tree.set(1, 0, 7);
        tree.add(2, 2, 9);
        tree.add(1, 0, -4);
        tree.add(1, 1, 2, 2, 5);
    }

    @Test
    void arrayBackedRectangleUpdates() {
        RangeFenwickTree2D tree = new RangeFenwickTree2D(3, 3);
        fill(tree);
        assertEquals(11L, tree.sum(0, 0, 0, 1));
        assertEquals(8L, tree.sum(1, 0, 1, 1));
        assertEquals(29L, tree.sum(1, 1, 2, 2));
        assertEquals(43L, tree.sum(2, 2));
        assertEquals(14L, tree.at(2, 2));
        assertEquals(0L, tree.sum(-1, 2));
    }

    @Test
    void compressedGridOfABillionSquared() {
        final int n = 1_000_000_001;
        CompressedFenwickTree2D tree = new CompressedFenwickTree2D(n, n);
        fill(tree);
        assertEquals(11L, tree.sum(0, 0, 0, 1));
        assertEquals(8L, tree.sum(1, 0, 1, 1));
        assertEquals(29L, tree.sum(1, 1, 2, 2));
        tree.set(500_000_000, 500_000_000, 100);
        assertEquals(143L, tree.sum(0, 0, 1_000_000_000, 1_000_000_000));
        assertEquals(100L, tree.at(500_000_000, 500_000_000));
        assertEquals(0L, tree.at(500_000_000, 500_000_001));
        assertTrue(tree.cellCount() > 0);
    }

    @Test
    void randomRectanglesAgainstNaiveGrid() {
        Random rnd = new Random(23);
        final int rows = 9;
        final int cols = 13;
        long[][] naive = new long[rows][cols];
        RangeFenwickTree2D array = new RangeFenwickTree2D(rows, cols);
        CompressedFenwickTree2D compressed = new CompressedFenwickTree2D(rows, cols);
        for (int step = 0; step < 500; step++) {
            int r1 = rnd.nextInt(rows);
            int r2 = r1 + rnd.nextInt(rows - r1);
            int c1 = rnd.nextInt(cols);
            int c2 = c1 + rnd.nextInt(cols - c1);
            long x = rnd.nextInt(100) - 50;
            array.add(r1, c1, r2, c2, x);
            compressed.add(r1, c1, r2, c2, x);
            for (int i = r1; i <= r2; i++) {
                for (int j = c1; j <= c2; j++) {
                    naive[i][j] += x;
                }
            }
            int qr1 = rnd.nextInt(rows);
            int qr2 = qr1 + rnd.nextInt(rows - qr1);
            int qc1 = rnd.nextInt(cols);
            int qc2 = qc1 + rnd.nextInt(cols - qc1);
            long expected = 0L;
            for (int i = qr1; i <= qr2; i++) {
                for (int j = qc1; j <= qc2; j++) {
                    expected += naive[i][j];
                }
            }
            assertEquals(expected, array.sum(qr1, qc1, qr2, qc2));
            assertEquals(expected, compressed.sum(qr1, qc1, qr2, qc2));
        }
    }

    @Test
    void pointUpdateTreeAgainstNaiveGrid() {
        Random rnd = new Random(29);
        final int rows = 7;
        final int cols = 5;
        long[][] naive = new long[rows][cols];
        FenwickTree2D tree = new FenwickTree2D(rows, cols);
        for (int step = 0; step < 500; step++) {
            int r = rnd.nextInt(rows);
            int c = rnd.nextInt(cols);
            long x = rnd.nextInt(100) - 50;
            if (rnd.nextBoolean()) {
                tree.add(r, c, x);
                naive[r][c] += x;
            } else {
                tree.set(r, c, x);
                naive[r][c] = x;
            }
            int qr = rnd.nextInt(rows);
            int qc = rnd.nextInt(cols);
            long expected = 0L;
            for (int i = qr; i < rows; i++) {
                for (int j = qc; j < cols; j++) {
                    expected += naive[i][j];
                }
            }
            assertEquals(expected, tree.sum(qr, qc, rows - 1, cols - 1));
        }
        assertEquals(0L, tree.sum(3, 3, 2, 2));
    }

    @Test
    void rejectsCellsOutsideTheGrid() {
        RangeFenwickTree2D tree = new RangeFenwickTree2D(3, 3);
        assertThrows(AlgorithmException.class, () -> tree.add(0, 0, 3, 0, 1));
        assertThrows(AlgorithmException.class, () -> tree.add(2, 2, 1, 1, 1));
        assertThrows(AlgorithmException.class, () -> tree.sum(0, 3));
        assertThrows(AlgorithmException.class, () -> new CompressedFenwickTree2D(Integer.MAX_VALUE, 1));
        assertThrows(AlgorithmException.class, () -> new FenwickTree2D(-1, 2));
    }
}
