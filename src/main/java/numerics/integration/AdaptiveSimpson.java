package numerics.integration;

import org.apache.commons.math3.analysis.UnivariateFunction;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

/**
 * Adaptive Simpson quadrature.
 *
 * <p>An interval is accepted once Simpson's rule on its two halves agrees with Simpson's
 * rule on the whole to within {@code eps}; otherwise each half is refined on its own. The
 * refinement depth is capped at {@code ceil(log2(|b - a| / eps))} (at least one level),
 * which bounds the work for integrands that never settle. Function values at shared
 * endpoints and midpoints are computed once.</p>
 */
public final class AdaptiveSimpson {

    public static final double DEFAULT_EPSILON = 1e-15;

    private AdaptiveSimpson() {
    }

    public static double integrate(UnivariateFunction f, double a, double b) {
        return integrate(f, a, b, DEFAULT_EPSILON);
    }

    /**
     * Integral of {@code f} from {@code a} to {@code b}; negative when {@code b < a}.
     */
    public static double integrate(UnivariateFunction f, double a, double b, double eps) {
        if (f == null) {
            throw AlgorithmException.invalidArgument("integrand must be non-null");
        }
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw AlgorithmException.invalidArgument("bounds must be finite, got [%s, %s]", a, b);
        }
        if (!(eps > 0.0) || Double.isInfinite(eps)) {
            throw AlgorithmException.invalidArgument("eps must be positive and finite, got %s", eps);
        }
        if (a == b) {
            return 0.0;
        }
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(Math.abs(b - a) / eps) / Math.log(2.0)));
        double fa = f.value(a);
        double fb = f.value(b);
        double m = (a + b) / 2;
        double fm = f.value(m);
        double whole = simpson(a, b, fa, fm, fb);
        return adapt(f, a, b, fa, fm, fb, whole, eps, maxDepth);
    }

    private static double simpson(double l, double r, double fl, double fm, double fr) {
        return (r - l) / 6 * (fl + 4 * fm + fr);
    }

    private static double adapt(UnivariateFunction f, double l, double r, double fl, double fm, double fr,
                                double whole, double eps, int depth) {
        double m = (l + r) / 2;
        double lm = (l + m) / 2;
        double mr = (m + r) / 2;
        double flm = f.value(lm);
        double fmr = f.value(mr);
        double left = simpson(l, m, fl, flm, fm);
        double right = simpson(m, r, fm, fmr, fr);
        double sum = left + right;
        if (Math.abs(sum - whole) < eps) {
            return sum;
        }
        if (depth <= 1) {
            if (AlgoLogger.isTraceEnabled()) {
                AlgoLogger.trace("Simpson depth limit reached on [" + l + ", " + r + "]");
            }
            return sum;
        }
        return adapt(f, l, m, fl, flm, fm, left, eps, depth - 1)
                + adapt(f, m, r, fm, fmr, fr, right, eps, depth - 1);
    }
}
