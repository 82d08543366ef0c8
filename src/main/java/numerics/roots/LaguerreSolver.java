package numerics.roots;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.List;

/**
 * Laguerre's method for polynomials with complex coefficients.
 *
 * <p>Coefficients are given lowest degree first. For an iterate {@code x} of a degree
 * {@code n} polynomial, with {@code G = p'/p} and {@code H = G^2 - p''/p}, the step is
 * {@code n / (G +- sqrt((n - 1)(nH - G^2)))} where the sign makes the denominator larger
 * in modulus. Iteration stops once {@code |p(x)|} is below {@code epsilon} or below the
 * rounding error of its own evaluation, or once the step is within {@code epsilon} relative
 * to {@code max(1, |x|)}.</p>
 *
 * <p>{@link #findAllRoots(Complex[])} finds one root of the deflated polynomial, polishes
 * it against the original polynomial, divides it out and repeats. The first start is a
 * random point of the unit square. An attempt that leaves the finite range, jumps past a
 * multiple of the Cauchy bound or runs out of iterations is restarted on a circle whose
 * radius is the geometric mean of the root moduli, {@code |q_0 / q_n|^(1/n)}. Starting points
 * come from a {@link Well19937c} seeded per call, so results are reproducible.</p>
 *
 * <p>Every tenth step is shortened by a varying fraction, which breaks the limit cycles
 * plain Laguerre iteration can fall into.</p>
 */
public final class LaguerreSolver {

    static final int MAX_RESTARTS = 64;

    private static final int CYCLE_BREAK_PERIOD = 10;
    private static final double[] CYCLE_BREAK_FRACTIONS = {0.5, 0.25, 0.75, 0.13, 0.38, 0.62, 0.88, 1.0};

    private final RootFinderOptions options;

    public LaguerreSolver() {
        this(RootFinderOptions.defaults());
    }

    public LaguerreSolver(RootFinderOptions options) {
        if (options == null) {
            throw AlgorithmException.invalidArgument("options must be non-null");
        }
        this.options = options;
    }

    public RootFinderOptions options() {
        return options;
    }

    /**
     * One root of {@code p} reached from {@code guess}.
     *
     * @throws AlgorithmException {@code INVALID_ARGUMENT} if {@code p} has a zero leading
     *                            coefficient or degree below one, {@code DOES_NOT_CONVERGE} if
     *                            the iteration diverges or does not settle within
     *                            {@code maxIterations} steps
     */
    public Complex findOneRoot(Complex[] p, Complex guess) {
        checkCoefficients(p);
        if (p.length < 2) {
            throw AlgorithmException.invalidArgument("a constant polynomial has no root to find");
        }
        if (guess == null || guess.isNaN() || guess.isInfinite()) {
            throw AlgorithmException.invalidArgument("guess must be a finite complex number");
        }
        Complex root = iterate(p, guess, escapeRadius(p, guess));
        if (root == null) {
            throw AlgorithmException.doesNotConverge("Laguerre did not converge from %s within %d iterations",
                    guess, options.maxIterations());
        }
        return root;
    }

    /**
     * Laguerre iteration from {@code guess}; {@code null} when the iterate is no longer finite,
     * leaves the disc of radius {@code escape} or has not settled after {@code maxIterations}.
     */
    private Complex iterate(Complex[] p, Complex guess, double escape) {
        final int n = p.length - 1;
        final double eps = options.epsilon();
        Complex[] p1 = derivative(p);
        Complex[] p2 = derivative(p1);
        Complex x = guess;
        for (int iter = 1; iter <= options.maxIterations(); iter++) {
            Complex y0 = evaluate(p, x);
            if (y0.abs() <= Math.max(eps, roundingBound(p, x))) {
                if (AlgoLogger.isTraceEnabled()) {
                    AlgoLogger.trace("Laguerre converged on |p(x)| after " + iter + " iterations");
                }
                return x;
            }
            Complex g = evaluate(p1, x).divide(y0);
            Complex h = g.multiply(g).subtract(evaluate(p2, x).divide(y0));
            Complex r = h.multiply(n).subtract(g.multiply(g)).multiply(n - 1).sqrt();
            Complex d1 = g.add(r);
            Complex d2 = g.subtract(r);
            Complex denominator = d1.abs() >= d2.abs() ? d1 : d2;
            Complex a;
            if (denominator.abs() == 0.0) {
                // Stationary point: jump off it along a direction that changes every iteration.
                a = new Complex(Math.cos(iter), Math.sin(iter)).multiply(1.0 + x.abs());
            } else {
                a = new Complex(n).divide(denominator);
            }
            if (iter % CYCLE_BREAK_PERIOD == 0) {
                a = a.multiply(CYCLE_BREAK_FRACTIONS[(iter / CYCLE_BREAK_PERIOD) % CYCLE_BREAK_FRACTIONS.length]);
            }
            x = x.subtract(a);
            if (x.isNaN() || x.isInfinite() || x.abs() > escape) {
                if (AlgoLogger.isTraceEnabled()) {
                    AlgoLogger.trace("Laguerre iterate escaped after " + iter + " steps");
                }
                return null;
            }
            if (a.abs() <= eps * Math.max(1.0, x.abs())) {
                if (AlgoLogger.isTraceEnabled()) {
                    AlgoLogger.trace("Laguerre converged on step size after " + iter + " iterations");
                }
                return x;
            }
        }
        if (AlgoLogger.isTraceEnabled()) {
            AlgoLogger.trace("Laguerre used all " + options.maxIterations() + " iterations");
        }
        return null;
    }

    /**
     * All {@code degree} roots of {@code p}, with multiplicity, in the order they were found.
     *
     * @throws AlgorithmException {@code DOES_NOT_CONVERGE} if some deflated polynomial
     *                            defeats {@value #MAX_RESTARTS} restarts
     */
    public List<Complex> findAllRoots(Complex[] p) {
        checkCoefficients(p);
        RandomGenerator rng = new Well19937c(options.seed());
        List<Complex> roots = new ArrayList<>(p.length);
        Complex[] q = p.clone();
        int restarts = 0;
        while (q.length > 2) {
            Complex z = new Complex(rng.nextDouble(), rng.nextDouble());
            Complex root = iterate(q, z, escapeRadius(q, z));
            for (int attempt = 1; root == null; attempt++) {
                if (attempt > MAX_RESTARTS) {
                    throw AlgorithmException.doesNotConverge(
                            "Laguerre found no root of a degree %d factor after %d restarts", q.length - 1, MAX_RESTARTS);
                }
                restarts++;
                z = restartPoint(q, rng);
                root = iterate(q, z, escapeRadius(q, z));
            }
            Complex polished = iterate(p, root, escapeRadius(p, root));
            if (polished != null) {
                root = polished;
            }
            q = deflate(q, root);
            roots.add(root);
        }
        if (q.length == 2) {
            roots.add(q[0].negate().divide(q[1]));
        }
        if (AlgoLogger.isDebugEnabled()) {
            AlgoLogger.debug("Laguerre found " + roots.size() + " roots with " + restarts + " restarts");
        }
        return roots;
    }

    public List<Complex> findAllRoots(Polynomial p) {
        if (p == null || p.isZero()) {
            throw AlgorithmException.invalidArgument("the zero polynomial has no finite set of roots");
        }
        return findAllRoots(p.toComplex());
    }

    /**
     * Adams' estimate of the rounding error of Horner's rule at {@code x}; once {@code |p(x)|}
     * drops below it no further step can be trusted.
     */
    static double roundingBound(Complex[] p, Complex x) {
        final double ax = x.abs();
        double err = p[p.length - 1].abs();
        Complex y = p[p.length - 1];
        for (int i = p.length - 2; i >= 0; i--) {
            y = y.multiply(x).add(p[i]);
            err = y.abs() + ax * err;
        }
        return err * Math.ulp(1.0);
    }

    /**
     * Upper bound on every root modulus: {@code 1 + max |p_i / p_n|} over {@code i < n}.
     */
    static double cauchyBound(Complex[] p) {
        final int n = p.length - 1;
        double lead = p[n].abs();
        double max = 0.0;
        for (int i = 0; i < n; i++) {
            max = Math.max(max, p[i].abs() / lead);
        }
        return 1.0 + max;
    }

    // Iterates this far out are not heading for any root.
    private static double escapeRadius(Complex[] p, Complex start) {
        return 4.0 * Math.max(cauchyBound(p), start.abs());
    }

    private static Complex restartPoint(Complex[] q, RandomGenerator rng) {
        final int n = q.length - 1;
        double radius = Math.pow(q[0].abs() / q[n].abs(), 1.0 / n);
        if (!(radius > 0.0) || Double.isInfinite(radius)) {
            radius = 1.0;
        }
        radius *= 0.95 + 0.1 * rng.nextDouble();
        double angle = 2.0 * Math.PI * rng.nextDouble();
        return new Complex(radius * Math.cos(angle), radius * Math.sin(angle));
    }

    static Complex evaluate(Complex[] p, Complex x) {
        Complex y = p[p.length - 1];
        for (int i = p.length - 2; i >= 0; i--) {
            y = y.multiply(x).add(p[i]);
        }
        return y;
    }

    static Complex[] derivative(Complex[] p) {
        if (p.length == 1) {
            return new Complex[]{Complex.ZERO};
        }
        Complex[] d = new Complex[p.length - 1];
        for (int i = 1; i < p.length; i++) {
            d[i - 1] = p[i].multiply(i);
        }
        return d;
    }

    /**
     * Quotient of {@code p} by {@code (x - root)} through synthetic division; the remainder
     * is dropped.
     */
    static Complex[] deflate(Complex[] p, Complex root) {
        final int n = p.length - 1;
        Complex[] b = new Complex[n];
        b[n - 1] = p[n];
        for (int i = n - 1; i > 0; i--) {
            b[i - 1] = p[i].add(b[i].multiply(root));
        }
        return b;
    }

    private static void checkCoefficients(Complex[] p) {
        if (p == null || p.length == 0) {
            throw AlgorithmException.invalidArgument("coefficients must be non-empty");
        }
        for (int i = 0; i < p.length; i++) {
            if (p[i] == null || p[i].isNaN() || p[i].isInfinite()) {
                throw AlgorithmException.invalidArgument("coefficient %d must be a finite complex number", i);
            }
        }
        if (p[p.length - 1].abs() == 0.0) {
            throw AlgorithmException.invalidArgument("leading coefficient must be non-zero");
        }
    }
}
