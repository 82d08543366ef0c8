package numerics.modular;

import utilities.AlgorithmException;

/**
 * Arithmetic modulo {@code m} for operands and moduli in {@code [0, 2^63)}.
 *
 * <p>{@link #mulmod} never forms the full product: it doubles and adds over the bits of
 * one operand, so every intermediate sum stays below {@code 2m < 2^64} and is compared
 * as an unsigned value.</p>
 */
public final class ModularArithmetic {

    private ModularArithmetic() {
    }

    /**
     * {@code (a * b) mod m}.
     *
     * @throws AlgorithmException {@code OVERFLOW} if an argument is negative, that is at
     *                            least {@code 2^63} as an unsigned value; {@code INVALID_ARGUMENT}
     *                            if {@code m} is zero
     */
    public static long mulmod(long a, long b, long m) {
        checkOperand(a, "a");
        checkOperand(b, "b");
        checkModulus(m);
        return mulmodUnchecked(a % m, b % m, m);
    }

    static long mulmodUnchecked(long a, long b, long m) {
        long result = 0L;
        long x = a;
        for (long y = b; y > 0; y >>>= 1) {
            if ((y & 1L) != 0) {
                result = addmod(result, x, m);
            }
            x = addmod(x, x, m);
        }
        return result;
    }

    // x, y < m < 2^63, so x + y fits in 64 unsigned bits.
    private static long addmod(long x, long y, long m) {
        long s = x + y;
        if (Long.compareUnsigned(s, m) >= 0) {
            s -= m;
        }
        return s;
    }

    /**
     * {@code base^exp mod m} by square-and-multiply.
     */
    public static long powmod(long base, long exp, long m) {
        checkOperand(base, "base");
        checkOperand(exp, "exp");
        checkModulus(m);
        return powmodUnchecked(base % m, exp, m);
    }

    static long powmodUnchecked(long base, long exp, long m) {
        long result = 1L % m;
        long b = base;
        for (long e = exp; e > 0; e >>>= 1) {
            if ((e & 1L) != 0) {
                result = mulmodUnchecked(result, b, m);
            }
            b = mulmodUnchecked(b, b, m);
        }
        return result;
    }

    public static long gcd(long a, long b) {
        checkOperand(a, "a");
        checkOperand(b, "b");
        return gcdUnchecked(a, b);
    }

    static long gcdUnchecked(long a, long b) {
        while (b != 0) {
            long t = b;
            b = a % b;
            a = t;
        }
        return a;
    }

    /**
     * The {@code x} in {@code [0, m)} with {@code a * x = 1 (mod m)}, by extended Euclid.
     *
     * @throws AlgorithmException {@code INVALID_ARGUMENT} if {@code gcd(a, m) != 1}
     */
    public static long modInverse(long a, long m) {
        checkOperand(a, "a");
        checkModulus(m);
        long oldR = a % m;
        long r = m;
        long oldS = 1L;
        long s = 0L;
        while (r != 0) {
            long q = oldR / r;
            long t = oldR - q * r;
            oldR = r;
            r = t;
            t = oldS - q * s;
            oldS = s;
            s = t;
        }
        if (oldR != 1) {
            throw AlgorithmException.invalidArgument("%d has no inverse modulo %d (gcd is %d)", a, m, oldR);
        }
        long x = oldS % m;
        return x < 0 ? x + m : x;
    }

    static void checkOperand(long x, String name) {
        if (x < 0) {
            throw AlgorithmException.overflow("%s must lie in [0, 2^63), got %s as unsigned",
                    name, Long.toUnsignedString(x));
        }
    }

    static void checkModulus(long m) {
        checkOperand(m, "m");
        if (m == 0) {
            throw AlgorithmException.invalidArgument("modulus must be positive");
        }
    }
}
