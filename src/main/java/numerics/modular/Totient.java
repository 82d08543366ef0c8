package numerics.modular;

import utilities.AlgorithmException;

/**
 * Euler's totient: the count of {@code k} in {@code [1, n]} coprime to {@code n}.
 */
public final class Totient {

    private Totient() {
    }

    public static long phi(long n) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("n must be non-negative, got %d", n);
        }
        long result = n;
        for (long i = 2; i <= n / i; i++) {
            if (n % i == 0) {
                while (n % i == 0) {
                    n /= i;
                }
                result -= result / i;
            }
        }
        if (n > 1) {
            result -= result / n;
        }
        return result;
    }

    /**
     * {@code phi(i)} for every {@code i} in {@code [0, n]}, by a divisor-sum sieve.
     */
    public static int[] phiTable(int n) {
        if (n < 0) {
            throw AlgorithmException.invalidArgument("n must be non-negative, got %d", n);
        }
        int[] phi = new int[n + 1];
        for (int i = 0; i <= n; i++) {
            phi[i] = i;
        }
        for (int i = 1; i <= n; i++) {
            for (long j = 2L * i; j <= n; j += i) {
                phi[(int) j] -= phi[i];
            }
        }
        return phi;
    }
}
