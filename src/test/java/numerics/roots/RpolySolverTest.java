package numerics.roots;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RpolySolverTest {

    @Test
    void cubicWithComplexPair() {
        // -1 + 2x - 6x^2 + 2x^3
        List<Complex> roots = RpolySolver.findAllRoots(new double[]{-1, 2, -6, 2});
        assertEquals(3, roots.size());
        assertHasRoot(roots, new Complex(0.150976, 0.403144), 1e-5);
        assertHasRoot(roots, new Complex(0.150976, -0.403144), 1e-5);
        assertHasRoot(roots, new Complex(2.69805, 0), 1e-5);
    }

    @Test
    void quadratic() {
        List<Complex> roots = RpolySolver.findAllRoots(new double[]{-20, 4, 3});
        assertEquals(2, roots.size());
        assertHasRoot(roots, new Complex(2, 0), 1e-12);
        assertHasRoot(roots, new Complex(-10.0 / 3, 0), 1e-12);
    }

    @Test
    void cubicWithIntegerRoots() {
        LaguerreSolverTest.assertRealRoots(new double[]{-4, 5, 7},
                RpolySolver.findAllRoots(new Polynomial(140, -13, -8, 1)), 1e-7);
    }

    @Test
    void zerosAtTheOriginComeFirst() {
        // x^2 (x - 1)
        List<Complex> roots = RpolySolver.findAllRoots(new double[]{0, 0, -1, 1});
        assertEquals(Complex.ZERO, roots.get(0));
        assertEquals(Complex.ZERO, roots.get(1));
        assertEquals(1.0, roots.get(2).getReal(), 1e-12);
    }

    @Test
    void linear() {
        List<Complex> roots = RpolySolver.findAllRoots(new double[]{3, -2});
        assertEquals(1, roots.size());
        assertEquals(1.5, roots.get(0).getReal(), 0.0);
    }

    @Test
    void agreesWithKnownRootsOnRandomPolynomials() {
        Random rnd = new Random(11);
        for (int trial = 0; trial < 40; trial++) {
            int degree = 3 + rnd.nextInt(5);
            double[] roots = LaguerreSolverTest.distinctIntegers(rnd, degree);
            Polynomial p = Polynomial.fromRoots(roots);
            LaguerreSolverTest.assertRealRoots(roots, RpolySolver.findAllRoots(p), 1e-6);
        }
    }

    @Test
    void conjugatePairsOfAProductOfQuadratics() {
        // (x^2 + 1)(x^2 + 2x + 5)(x - 3): roots +-i, -1 +- 2i, 3
        Polynomial p = new Polynomial(1, 0, 1).multiply(new Polynomial(5, 2, 1)).multiply(new Polynomial(-3, 1));
        List<Complex> roots = RpolySolver.findAllRoots(p);
        assertEquals(5, roots.size());
        assertHasRoot(roots, new Complex(0, 1), 1e-8);
        assertHasRoot(roots, new Complex(0, -1), 1e-8);
        assertHasRoot(roots, new Complex(-1, 2), 1e-8);
        assertHasRoot(roots, new Complex(-1, -2), 1e-8);
        assertHasRoot(roots, new Complex(3, 0), 1e-8);
    }

    @Test
    void rejectsZeroLeadingCoefficient() {
        AlgorithmException e = assertThrows(AlgorithmException.class,
                () -> RpolySolver.findAllRoots(new double[]{1, 2, 0}));
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT, e.kind());
        assertThrows(AlgorithmException.class, () -> RpolySolver.findAllRoots(new double[]{1, Double.NaN}));
    }

    private static void assertHasRoot(List<Complex> roots, Complex expected, double tolerance) {
        assertTrue(roots.stream().anyMatch(r -> r.subtract(expected).abs() < tolerance),
                "missing root " + expected + " in " + roots);
    }
}
