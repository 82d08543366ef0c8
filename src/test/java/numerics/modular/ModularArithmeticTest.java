package numerics.modular;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModularArithmeticTest {

    @Test
    void mulmodNearTheTopOfTheRange() {
        long m = Long.MAX_VALUE - 24;
        long expected = BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.valueOf(Long.MAX_VALUE - 1))
                .mod(BigInteger.valueOf(m)).longValueExact();
        assertEquals(expected, ModularArithmetic.mulmod(Long.MAX_VALUE, Long.MAX_VALUE - 1, m));
        assertEquals(0L, ModularArithmetic.mulmod(12345, 0, 7));
        assertEquals(0L, ModularArithmetic.mulmod(12345, 678, 1));
    }

    @Test
    void agreesWithBigIntegerOnRandomOperands() {
        Random rnd = new Random(2024);
        for (int i = 0; i < 2000; i++) {
            long a = rnd.nextLong() >>> 1;
            long b = rnd.nextLong() >>> 1;
            long m = (rnd.nextLong() >>> 1) | 1L;
            BigInteger bm = BigInteger.valueOf(m);
            assertEquals(BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).mod(bm).longValueExact(),
                    ModularArithmetic.mulmod(a, b, m));
            long e = rnd.nextInt(1 << 20);
            assertEquals(BigInteger.valueOf(a).modPow(BigInteger.valueOf(e), bm).longValueExact(),
                    ModularArithmetic.powmod(a, e, m));
        }
    }

    @Test
    void gcdAndInverse() {
        assertEquals(6L, ModularArithmetic.gcd(54, 24));
        assertEquals(7L, ModularArithmetic.gcd(0, 7));
        assertEquals(4L, ModularArithmetic.modInverse(3, 11));
        long m = 1_000_000_007L;
        long inv = ModularArithmetic.modInverse(123456789L, m);
        assertEquals(1L, ModularArithmetic.mulmod(123456789L, inv, m));
        assertEquals(1L, ModularArithmetic.powmod(5, 0, 13));
    }

    @Test
    void errorKinds() {
        AlgorithmException overflow = assertThrows(AlgorithmException.class, () -> ModularArithmetic.mulmod(-1, 2, 5));
        assertEquals(AlgorithmException.Kind.OVERFLOW, overflow.kind());
        assertEquals(AlgorithmException.Kind.OVERFLOW,
                assertThrows(AlgorithmException.class, () -> ModularArithmetic.powmod(2, 3, Long.MIN_VALUE)).kind());
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT,
                assertThrows(AlgorithmException.class, () -> ModularArithmetic.mulmod(1, 2, 0)).kind());
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT,
                assertThrows(AlgorithmException.class, () -> ModularArithmetic.modInverse(6, 9)).kind());
    }
}
