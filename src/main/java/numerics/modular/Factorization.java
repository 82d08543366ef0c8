package numerics.modular;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Integer factorization. Factorizations are sorted arrays of primes repeated by
 * multiplicity; 0, 1 and primes factor as themselves.
 */
public final class Factorization {

    private Factorization() {
    }

    /**
     * Prime factorization by trial division, {@code O(sqrt n)}.
     */
    public static long[] primeFactorize(long n) {
        checkNonNegative(n);
        if (n <= 3) {
            return new long[]{n};
        }
        LongArrayList factors = new LongArrayList();
        for (long i = 2; i <= n / i; i++) {
            while (n % i == 0) {
                factors.add(i);
                n /= i;
            }
        }
        if (n > 1) {
            factors.add(n);
        }
        return factors.toLongArray();
    }

    public static long[] primeFactorizeBig(long n) {
        return primeFactorizeBig(n, FactorizationOptions.defaults());
    }

    /**
     * Prime factorization of any non-negative long: trial division by 2, 3 and
     * {@code 6k +- 1} up to the configured cutoff, then Miller-Rabin and Pollard rho on
     * what is left. A composite divisor returned by rho is split further.
     */
    public static long[] primeFactorizeBig(long n, FactorizationOptions options) {
        checkNonNegative(n);
        if (options == null) {
            throw AlgorithmException.invalidArgument("options must be non-null");
        }
        if (n <= 3) {
            return new long[]{n};
        }
        final long cutoff = options.trialDivisionCutoff();
        LongArrayList factors = new LongArrayList();
        for (; n % 2 == 0; n /= 2) {
            factors.add(2);
        }
        for (; n % 3 == 0; n /= 3) {
            factors.add(3);
        }
        long i = 5;
        for (long w = 2; i <= cutoff && i <= n / i; i += w, w = 6 - w) {
            for (; n % i == 0; n /= i) {
                factors.add(i);
            }
        }
        // Without a divisor up to sqrt(n) the rest is prime; a cutoff stop proves nothing.
        boolean exhausted = i > n / i;
        if (n != 1 && !exhausted && !PrimalityTest.isPrime(n)) {
            splitWithRho(n, new Well19937c(options.seed()), factors);
        } else if (n != 1) {
            factors.add(n);
        }
        long[] out = factors.toLongArray();
        Arrays.sort(out);
        return out;
    }

    private static void splitWithRho(long composite, RandomGenerator rng, LongArrayList factors) {
        LongArrayList pending = new LongArrayList();
        pending.push(composite);
        int restarts = 0;
        while (!pending.isEmpty()) {
            long m = pending.popLong();
            if (PrimalityTest.isPrime(m)) {
                factors.add(m);
                continue;
            }
            long d;
            do {
                d = PollardRho.brent(m, rng);
                if (d == m) {
                    restarts++;
                }
            } while (d == m);
            pending.push(d);
            pending.push(m / d);
        }
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Pollard rho split " + composite + " with " + restarts + " restarts");
        }
    }

    /**
     * All positive divisors of {@code n}, ascending; empty for {@code n < 1}.
     */
    public static long[] divisors(long n) {
        if (n < 1) {
            return new long[0];
        }
        LongArrayList small = new LongArrayList();
        LongArrayList large = new LongArrayList();
        for (long i = 1; i <= n / i; i++) {
            if (n % i == 0) {
                small.add(i);
                if (i != n / i) {
                    large.add(n / i);
                }
            }
        }
        for (int i = large.size() - 1; i >= 0; i--) {
            small.add(large.getLong(i));
        }
        return small.toLongArray();
    }

    /**
     * Fermat's difference-of-squares method: searches for {@code n = x^2 - y^2} starting at
     * {@code x = floor(sqrt n)} and returns {@code x - y}. Fast when {@code n} has two
     * factors close to {@code sqrt n}; otherwise as slow as trial division.
     *
     * @return a divisor of {@code n}, which is 1 or {@code n} when no proper factor was
     * found (always so for primes); 2 for even {@code n}
     */
    public static long fermat(long n) {
        if (n < 1) {
            throw AlgorithmException.invalidArgument("n must be positive, got %d", n);
        }
        if (n % 2 == 0) {
            return 2;
        }
        long x = (long) Math.sqrt((double) n);
        long y = 0;
        long r = x * x - n;
        while (r != 0) {
            if (r < 0) {
                r += x + x + 1;
                x++;
            } else {
                r -= y + y + 1;
                y++;
            }
        }
        return x - y;
    }

    private static void checkNonNegative(long n) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("n must be non-negative, got %d", n);
        }
    }
}
