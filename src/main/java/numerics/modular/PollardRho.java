package numerics.modular;

import org.apache.commons.math3.random.RandomGenerator;
import utilities.AlgorithmException;

/**
 * Pollard's rho with Brent's cycle detection.
 *
 * <p>The sequence {@code y <- y^2 + c (mod n)} is walked in blocks of {@code m} steps; the
 * products of {@code |x - y|} within a block are folded into one gcd with {@code n}. When
 * that gcd collapses to {@code n} the block is replayed one step at a time.</p>
 */
public final class PollardRho {

    private static final long MAX_BATCH = 1024L;

    private PollardRho() {
    }

    /**
     * A divisor of {@code n} greater than one. It is not necessarily prime, and it may be
     * {@code n} itself, always so when {@code n} is prime; callers retry with fresh randomness.
     *
     * @param n   at least 2
     * @param rng source of the starting point, the constant {@code c} and the block size
     */
    public static long brent(long n, RandomGenerator rng) {
        if (n < 2) {
            throw AlgorithmException.invalidArgument("n must be at least 2, got %d", n);
        }
        if (rng == null) {
            throw AlgorithmException.invalidArgument("random generator must be non-null");
        }
        if (n % 2 == 0) {
            return 2;
        }
        long y = Math.floorMod(rng.nextLong(), n - 1) + 1;
        long c = Math.floorMod(rng.nextLong(), n - 1) + 1;
        long m = Math.floorMod(rng.nextLong(), Math.min(n - 1, MAX_BATCH)) + 1;
        long g = 1;
        long q = 1;
        long x = 0;
        long ys = 0;
        for (long r = 1; g == 1; r <<= 1) {
            x = y;
            for (long i = 0; i < r; i++) {
                y = step(y, c, n);
            }
            for (long k = 0; k < r && g == 1; k += m) {
                ys = y;
                long lim = Math.min(m, r - k);
                for (long j = 0; j < lim; j++) {
                    y = step(y, c, n);
                    q = ModularArithmetic.mulmodUnchecked(q, Math.abs(x - y), n);
                }
                g = ModularArithmetic.gcdUnchecked(q, n);
            }
        }
        if (g == n) {
            do {
                ys = step(ys, c, n);
                g = ModularArithmetic.gcdUnchecked(Math.abs(x - ys), n);
            } while (g <= 1);
        }
        return g;
    }

    private static long step(long y, long c, long n) {
        long sq = ModularArithmetic.mulmodUnchecked(y, y, n);
        long s = sq + c;
        // sq, c < n < 2^63
        if (s < 0 || s >= n) {
            s -= n;
        }
        return s;
    }
}
