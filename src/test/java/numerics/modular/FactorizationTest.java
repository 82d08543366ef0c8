package numerics.modular;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactorizationTest {

    @Test
    void mixedSmallAndLargePrimes() {
        long n = 2L * 2 * 3 * 1_000_003 * 100_000_037;
        assertArrayEquals(new long[]{2, 2, 3, 1_000_003, 100_000_037}, Factorization.primeFactorizeBig(n));
    }

    @Test
    void primesOneAboveAMultipleOfSixAreTried() {
        assertArrayEquals(new long[]{7, 7}, Factorization.primeFactorizeBig(49));
        assertArrayEquals(new long[]{7, 13}, Factorization.primeFactorizeBig(91));
        assertArrayEquals(new long[]{13, 19, 31}, Factorization.primeFactorizeBig(13L * 19 * 31));
        assertArrayEquals(new long[]{999_961, 999_961}, Factorization.primeFactorizeBig(999_961L * 999_961L));
    }

    @Test
    void leftoverBelowTheCutoffIsCheckedBeforeItCountsAsPrime() {
        // Trial division stops at 100, short of sqrt(n), for every value below.
        FactorizationOptions options = FactorizationOptions.builder().trialDivisionCutoff(100).seed(3).build();
        assertArrayEquals(new long[]{103, 109}, Factorization.primeFactorizeBig(103L * 109, options));
        assertArrayEquals(new long[]{101, 101, 101}, Factorization.primeFactorizeBig(101L * 101 * 101, options));
        FactorizationOptions tiny = FactorizationOptions.builder().trialDivisionCutoff(1).seed(3).build();
        assertArrayEquals(new long[]{5, 5}, Factorization.primeFactorizeBig(25, tiny));
        assertArrayEquals(new long[]{7, 11}, Factorization.primeFactorizeBig(77, tiny));
        for (long n = 2; n <= 3000; n++) {
            assertArrayEquals(Factorization.primeFactorize(n), Factorization.primeFactorizeBig(n, options), "n = " + n);
        }
    }

    @Test
    void trialDivisionAndRhoAgreeOnSmallInputs() {
        for (long n = 0; n <= 10_000; n++) {
            long[] trial = Factorization.primeFactorize(n);
            assertArrayEquals(trial, Factorization.primeFactorizeBig(n), "n = " + n);
            validate(n, trial);
        }
    }

    @Test
    void largeComposites() {
        long[] tests = {
                3L * 3 * 5 * 7 * 9949 * 9967 * 1000003,
                2L * 1000003 * 1000000007,
                999961L * 1000033,
                357267896789127671L,
                2L * 2 * 2 * 2 * 2 * 2 * 2 * 3 * 3 * 3 * 3 * 5 * 5 * 7 * 7 * 11 * 13 * 17 * 19 * 23 * 29 * 31 * 37,
                2L * 2 * 2 * 2 * 2 * 2 * 2 * 3 * 3 * 3 * 3 * 5 * 5 * 7 * 7 * 35336848213L,
                2L * 2 * 2 * 2 * 2 * 2 * 2 * 3 * 3 * 3 * 3 * 5 * 5 * 7 * 7 * 186917 * 186947,
        };
        for (long n : tests) {
            validate(n, Factorization.primeFactorizeBig(n));
        }
    }

    @Test
    void compositeRhoFactorsAreSplitFurther() {
        // With a tiny cutoff everything past 7 goes through rho.
        FactorizationOptions options = FactorizationOptions.builder().trialDivisionCutoff(7).seed(99).build();
        long n = 11L * 13 * 17 * 19 * 23 * 29 * 31 * 37 * 41 * 43;
        assertArrayEquals(new long[]{11, 13, 17, 19, 23, 29, 31, 37, 41, 43},
                Factorization.primeFactorizeBig(n, options));
        long square = 1_000_003L * 1_000_003L;
        assertArrayEquals(new long[]{1_000_003, 1_000_003}, Factorization.primeFactorizeBig(square, options));
    }

    @Test
    void divisors() {
        assertArrayEquals(new long[]{1, 2, 3, 4, 6, 12}, Factorization.divisors(12));
        assertArrayEquals(new long[]{1, 7, 49}, Factorization.divisors(49));
        assertArrayEquals(new long[]{1}, Factorization.divisors(1));
        assertArrayEquals(new long[0], Factorization.divisors(0));
        for (long n = 1; n <= 2000; n++) {
            List<Long> expected = new ArrayList<>();
            for (long d = 1; d <= n; d++) {
                if (n % d == 0) {
                    expected.add(d);
                }
            }
            long[] got = Factorization.divisors(n);
            assertEquals(expected.size(), got.length);
            for (int i = 0; i < got.length; i++) {
                assertEquals(expected.get(i).longValue(), got[i]);
            }
        }
    }

    @Test
    void fermatFindsCloseFactorsAndReportsFailureAsOneOrN() {
        assertEquals(1_000_003L, Factorization.fermat(1_000_003L * 100_000_037L));
        assertEquals(999_961L, Factorization.fermat(999_961L * 1_000_033L));
        assertEquals(1L, Factorization.fermat(1_000_003L));
        assertEquals(2L, Factorization.fermat(1L << 40));
        assertEquals(1L, Factorization.fermat(1L));
    }

    @Test
    void pollardRhoReturnsADivisor() {
        Well19937c rng = new Well19937c(7);
        long n = 1_000_003L * 1_000_033L;
        long d;
        do {
            d = PollardRho.brent(n, rng);
        } while (d == n);
        assertTrue(d == 1_000_003L || d == 1_000_033L);
        assertEquals(2L, PollardRho.brent(1L << 50, rng));
    }

    @Test
    void rejectsNegativeInput() {
        assertThrows(AlgorithmException.class, () -> Factorization.primeFactorizeBig(-10));
        assertThrows(AlgorithmException.class, () -> Factorization.fermat(0));
        assertThrows(AlgorithmException.class, () -> FactorizationOptions.builder().trialDivisionCutoff(0).build());
    }

    private static void validate(long n, long[] factors) {
        if (n <= 1 || PrimalityTest.isPrime(n)) {
            assertArrayEquals(new long[]{n}, factors);
            return;
        }
        long product = 1;
        for (int i = 0; i < factors.length; i++) {
            assertTrue(PrimalityTest.isPrime(factors[i]), factors[i] + " in factorization of " + n);
            if (i > 0) {
                assertTrue(factors[i - 1] <= factors[i]);
            }
            product *= factors[i];
        }
        assertEquals(n, product);
    }
}
