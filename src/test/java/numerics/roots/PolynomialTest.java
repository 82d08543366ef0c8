package numerics.roots;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolynomialTest {

    @Test
    void trailingZerosAreDropped() {
        Polynomial p = new Polynomial(1, 2, 0, 0);
        assertEquals(1, p.degree());
        assertEquals(2.0, p.leadingCoefficient());
        assertTrue(new Polynomial(0, 0).isZero());
    }

    @Test
    void evaluateDeriveMultiply() {
        Polynomial p = new Polynomial(140, -13, -8, 1);
        assertEquals(0.0, p.evaluate(5.0), 0.0);
        assertEquals(140.0, p.evaluate(0.0), 0.0);
        assertArrayEquals(new double[]{-13, -16, 3}, p.derivative().coefficients());
        assertEquals(p, Polynomial.fromRoots(-4, 5, 7));
        Complex at = new Polynomial(1, 0, 1).evaluate(Complex.I);
        assertEquals(0.0, at.abs(), 1e-15);
    }
}
