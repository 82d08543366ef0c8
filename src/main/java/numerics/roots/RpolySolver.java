package numerics.roots;

import org.apache.commons.math3.complex.Complex;
import utilities.AlgoLogger;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Jenkins-Traub three-stage root finder for real polynomials (RPOLY, ACM TOMS 493).
 *
 * <p>Stage one applies five unshifted iterations to the auxiliary polynomial {@code K}.
 * Stage two runs fixed-shift iterations; the shift {@code s} starts on a circle of radius
 * equal to a lower bound on the root moduli and rotates by 94 degrees on every retry.
 * Stage three is either a real-shift (Newton-like) iteration for a linear factor or a
 * variable-shift iteration for a quadratic factor. Once a factor converges it is divided
 * out and the whole process repeats on the quotient. Degree two and one are solved in
 * closed form.</p>
 *
 * <p>Coefficients are taken lowest degree first, like {@link Polynomial}. Internally the
 * routine works highest degree first, as the published algorithm does.</p>
 */
public final class RpolySolver {

    private static final double ETA = Math.ulp(1.0);
    private static final double BASE = 2.0;
    private static final double INFINITY = Double.MAX_VALUE;
    private static final double SMALLEST = Double.MIN_NORMAL;
    private static final double COS_ROTATION = Math.cos(Math.toRadians(94.0));
    private static final double SIN_ROTATION = Math.sin(Math.toRadians(94.0));
    private static final int MAX_SHIFT_ROTATIONS = 20;

    private RpolySolver() {
    }

    /**
     * All roots of the real polynomial {@code sum coefficients[i] x^i}, with multiplicity.
     * Roots at the origin come first; complex roots come as adjacent conjugate pairs.
     *
     * @throws AlgorithmException {@code INVALID_ARGUMENT} for a zero leading coefficient or a
     *                            non-finite coefficient, {@code DOES_NOT_CONVERGE} if twenty
     *                            shift rotations fail to isolate a factor
     */
    public static List<Complex> findAllRoots(double[] coefficients) {
        if (coefficients == null || coefficients.length == 0) {
            throw AlgorithmException.invalidArgument("coefficients must be non-empty");
        }
        for (int i = 0; i < coefficients.length; i++) {
            if (!Double.isFinite(coefficients[i])) {
                throw AlgorithmException.invalidArgument("coefficient %d is not finite: %s", i, coefficients[i]);
            }
        }
        if (coefficients[coefficients.length - 1] == 0.0) {
            throw AlgorithmException.invalidArgument("leading coefficient must be non-zero");
        }
        final int degree = coefficients.length - 1;
        double[] descending = new double[degree + 1];
        for (int i = 0; i <= degree; i++) {
            descending[i] = coefficients[degree - i];
        }
        Rpoly solver = new Rpoly(descending);
        solver.solve();
        List<Complex> roots = new ArrayList<>(degree);
        for (int i = 0; i < degree; i++) {
            roots.add(new Complex(solver.zeroReal[i], solver.zeroImag[i]));
        }
        return roots;
    }

    public static List<Complex> findAllRoots(Polynomial p) {
        if (p == null || p.isZero()) {
            throw AlgorithmException.invalidArgument("the zero polynomial has no finite set of roots");
        }
        return findAllRoots(p.coefficients());
    }

    private enum Stage {
        QUADRATIC,
        REAL,
        RESTORE
    }

    /**
     * Working state of one solve. The helper routines of the published algorithm share a
     * large set of scalars; they live here as fields.
     */
    private static final class Rpoly {
        private final int degree;
        final double[] zeroReal;
        final double[] zeroImag;

        private final double[] p;
        private final double[] qp;
        private final double[] k;
        private final double[] qk;
        private final double[] svk;

        // Degree of the current (deflated) polynomial and its coefficient count.
        private int n;
        private int nn;

        // Shared by the quadratic division, scalar and K-polynomial updates.
        private double a;
        private double b;
        private double c;
        private double d;
        private double a1;
        private double a3;
        private double a7;
        private double e;
        private double f;
        private double g;
        private double h;

        // Smaller and larger root of the last quadratic solved.
        private double szr;
        private double szi;
        private double lzr;
        private double lzi;

        // Remainder of the last quadratic division.
        private double nextA;
        private double nextB;

        private int nz;
        private double nextU;
        private double nextV;
        private double realShift;

        Rpoly(double[] descending) {
            this.degree = descending.length - 1;
            this.zeroReal = new double[degree];
            this.zeroImag = new double[degree];
            this.p = descending.clone();
            this.qp = new double[degree + 1];
            this.k = new double[degree + 1];
            this.qk = new double[degree + 1];
            this.svk = new double[degree + 1];
        }

        void solve() {
            n = degree;
            // Zeros at the origin.
            while (n > 0 && p[n] == 0.0) {
                zeroReal[degree - n] = 0.0;
                zeroImag[degree - n] = 0.0;
                n--;
            }
            nn = n + 1;
            double xx = Math.sqrt(0.5);
            double yy = -xx;
            double[] temp = new double[degree + 1];
            double[] pt = new double[degree + 1];

            while (n >= 1) {
                if (n == 1) {
                    zeroReal[degree - 1] = -p[1] / p[0];
                    zeroImag[degree - 1] = 0.0;
                    return;
                }
                if (n == 2) {
                    quadratic(p[0], p[1], p[2]);
                    zeroReal[degree - 2] = szr;
                    zeroImag[degree - 2] = szi;
                    zeroReal[degree - 1] = lzr;
                    zeroImag[degree - 1] = lzi;
                    return;
                }

                scale();

                // Lower bound on the root moduli: the positive root of the Cauchy polynomial.
                for (int i = 0; i < nn; i++) {
                    pt[i] = Math.abs(p[i]);
                }
                pt[n] = -pt[n];
                double x = Math.exp((Math.log(-pt[n]) - Math.log(pt[0])) / n);
                if (pt[n - 1] != 0.0) {
                    double xm = -pt[n] / pt[n - 1];
                    if (xm < x) {
                        x = xm;
                    }
                }
                while (true) {
                    double xm = x * 0.1;
                    double ff = pt[0];
                    for (int i = 1; i < nn; i++) {
                        ff = ff * xm + pt[i];
                    }
                    if (ff <= 0.0) {
                        break;
                    }
                    x = xm;
                }
                double dx = x;
                while (Math.abs(dx / x) > 0.005) {
                    double ff = pt[0];
                    double df = ff;
                    for (int i = 1; i < n; i++) {
                        ff = ff * x + pt[i];
                        df = df * x + ff;
                    }
                    ff = ff * x + pt[n];
                    dx = ff / df;
                    x -= dx;
                }
                final double bound = x;

                // Stage one: K starts as the scaled derivative, then five unshifted steps.
                final int nm1 = n - 1;
                for (int i = 1; i < n; i++) {
                    k[i] = (n - i) * p[i] / n;
                }
                k[0] = p[0];
                final double aa = p[n];
                final double bb = p[nm1];
                boolean zeroK = k[nm1] == 0.0;
                for (int jj = 0; jj < 5; jj++) {
                    double cc = k[nm1];
                    if (zeroK) {
                        for (int j = nm1; j > 0; j--) {
                            k[j] = k[j - 1];
                        }
                        k[0] = 0.0;
                        zeroK = k[nm1] == 0.0;
                    } else {
                        double t = -aa / cc;
                        for (int j = nm1; j > 0; j--) {
                            k[j] = t * k[j - 1] + p[j];
                        }
                        k[0] = p[0];
                        zeroK = Math.abs(k[nm1]) <= Math.abs(bb) * ETA * 10.0;
                    }
                }
                System.arraycopy(k, 0, temp, 0, n);

                // Stages two and three, rotating the shift until a factor converges.
                boolean found = false;
                for (int rotation = 1; rotation <= MAX_SHIFT_ROTATIONS && !found; rotation++) {
                    double rotated = COS_ROTATION * xx - SIN_ROTATION * yy;
                    yy = SIN_ROTATION * xx + COS_ROTATION * yy;
                    xx = rotated;
                    double sr = bound * xx;
                    double u = -2.0 * sr;
                    Arrays.fill(qk, 0.0);
                    Arrays.fill(svk, 0.0);

                    fixedShift(20 * rotation, sr, u, bound);
                    if (nz != 0) {
                        int j = degree - n;
                        zeroReal[j] = szr;
                        zeroImag[j] = szi;
                        nn -= nz;
                        n = nn - 1;
                        System.arraycopy(qp, 0, p, 0, nn);
                        if (nz != 1) {
                            zeroReal[j + 1] = lzr;
                            zeroImag[j + 1] = lzi;
                        }
                        if (AlgoLogger.isTraceEnabled()) {
                            AlgoLogger.trace("RPOLY isolated " + nz + " root(s) after " + rotation + " shift rotation(s)");
                        }
                        found = true;
                    } else {
                        System.arraycopy(temp, 0, k, 0, n);
                    }
                }
                if (!found) {
                    throw AlgorithmException.doesNotConverge(
                            "RPOLY found no factor of the degree %d quotient after %d shift rotations", n, MAX_SHIFT_ROTATIONS);
                }
            }
        }

        // Power-of-two scaling so that the smallest coefficient does not underflow later on.
        private void scale() {
            double max = 0.0;
            double min = INFINITY;
            for (int i = 0; i < nn; i++) {
                double x = Math.abs(p[i]);
                if (x > max) {
                    max = x;
                }
                if (x != 0.0 && x < min) {
                    min = x;
                }
            }
            double sc = SMALLEST / ETA / min;
            if (sc > 1.0 && INFINITY / sc < max) {
                return;
            }
            if (sc <= 1.0) {
                if (max < 10.0) {
                    return;
                }
                if (sc == 0.0) {
                    sc = SMALLEST;
                }
            }
            long l = (long) (Math.log(sc) / Math.log(BASE) + 0.5);
            double factor = Math.pow(BASE, l);
            if (factor != 1.0) {
                for (int i = 0; i < nn; i++) {
                    p[i] *= factor;
                }
            }
        }

        /**
         * Stage two with shift {@code sr} ({@code u = -2 sr}, {@code v = bound}) for at most
         * {@code steps} iterations, handing over to stage three once either the real or the
         * quadratic estimates settle. Sets {@link #nz} to the number of roots found.
         */
        private void fixedShift(int steps, double sr, double u, double v) {
            nz = 0;
            double betav = 0.25;
            double betas = 0.25;
            double oss = sr;
            double ovv = v;
            double otv = 0.0;
            double ots = 0.0;

            quadraticDivide(nn, u, v, p, qp);
            a = nextA;
            b = nextB;
            int type = scalars(u, v);
            for (int j = 0; j < steps; j++) {
                nextK(type);
                type = scalars(u, v);
                estimateShift(type, u, v);
                double ui = nextU;
                double vi = nextV;
                double vv = vi;
                double ss = k[n - 1] != 0.0 ? -p[n] / k[n - 1] : 0.0;
                double tv = 1.0;
                double ts = 1.0;
                if (j != 0 && type != 3) {
                    tv = vv != 0.0 ? Math.abs((vv - ovv) / vv) : tv;
                    ts = ss != 0.0 ? Math.abs((ss - oss) / ss) : ts;
                    double tvv = tv < otv ? tv * otv : 1.0;
                    double tss = ts < ots ? ts * ots : 1.0;
                    boolean vpass = tvv < betav;
                    boolean spass = tss < betas;
                    if (spass || vpass) {
                        System.arraycopy(k, 0, svk, 0, n);
                        double s = ss;
                        boolean stry = false;
                        boolean vtry = false;
                        Stage stage = spass && (!vpass || tss < tvv) ? Stage.REAL : Stage.QUADRATIC;
                        boolean done = false;
                        while (!done) {
                            if (stage == Stage.QUADRATIC) {
                                quadraticIterate(ui, vi);
                                if (nz > 0) {
                                    return;
                                }
                                vtry = true;
                                betav *= 0.25;
                                if (stry || !spass) {
                                    stage = Stage.RESTORE;
                                } else {
                                    System.arraycopy(svk, 0, k, 0, n);
                                    stage = Stage.REAL;
                                }
                            } else if (stage == Stage.REAL) {
                                boolean stalled = realIterate(s);
                                if (nz > 0) {
                                    return;
                                }
                                stry = true;
                                betas *= 0.25;
                                if (stalled) {
                                    s = realShift;
                                    ui = -(s + s);
                                    vi = s * s;
                                    stage = Stage.QUADRATIC;
                                } else {
                                    stage = Stage.RESTORE;
                                }
                            } else {
                                System.arraycopy(svk, 0, k, 0, n);
                                if (vpass && !vtry) {
                                    stage = Stage.QUADRATIC;
                                } else {
                                    done = true;
                                }
                            }
                        }
                        quadraticDivide(nn, u, v, p, qp);
                        a = nextA;
                        b = nextB;
                        type = scalars(u, v);
                    }
                }
                ovv = vv;
                oss = ss;
                otv = tv;
                ots = ts;
            }
        }

        /**
         * Stage three for a quadratic factor {@code x^2 + ux + v}, starting from the
         * estimates {@code (uu, vv)}. Sets {@link #nz} to 2 on convergence.
         */
        private void quadraticIterate(double uu, double vv) {
            nz = 0;
            double u = uu;
            double v = vv;
            double relstp = 0.0;
            double omp = 0.0;
            boolean tried = false;
            int steps = 0;
            while (true) {
                quadratic(1.0, u, v);
                // Roots of unequal modulus mean this is not a quadratic factor.
                if (Math.abs(Math.abs(szr) - Math.abs(lzr)) > 0.01 * Math.abs(lzr)) {
                    return;
                }
                quadraticDivide(nn, u, v, p, qp);
                a = nextA;
                b = nextB;
                double mp = Math.abs(a - szr * b) + Math.abs(szi * b);
                double zm = Math.sqrt(Math.abs(v));
                double ee = 2.0 * Math.abs(qp[0]);
                double t = -szr * b;
                for (int i = 1; i < n; i++) {
                    ee = ee * zm + Math.abs(qp[i]);
                }
                ee = ee * zm + Math.abs(a + t);
                ee = (ee * 9.0 + 2.0 * Math.abs(t) - 7.0 * (Math.abs(a + t) + zm * Math.abs(b))) * ETA;
                if (mp <= 20.0 * ee) {
                    nz = 2;
                    return;
                }
                steps++;
                if (steps > 20) {
                    return;
                }
                if (steps >= 2 && relstp <= 0.01 && mp >= omp && !tried) {
                    // Stalled on a cluster: nudge the estimate and do five fixed-shift steps.
                    relstp = relstp < ETA ? Math.sqrt(ETA) : Math.sqrt(relstp);
                    u -= u * relstp;
                    v += v * relstp;
                    quadraticDivide(nn, u, v, p, qp);
                    a = nextA;
                    b = nextB;
                    for (int i = 0; i < 5; i++) {
                        int type = scalars(u, v);
                        nextK(type);
                    }
                    tried = true;
                    steps = 0;
                }
                omp = mp;
                int type = scalars(u, v);
                nextK(type);
                type = scalars(u, v);
                estimateShift(type, u, v);
                if (nextV == 0.0) {
                    return;
                }
                relstp = Math.abs((nextV - v) / nextV);
                u = nextU;
                v = nextV;
            }
        }

        /**
         * Stage three for a real linear factor starting from shift {@code start}. Sets
         * {@link #nz} to 1 on convergence.
         *
         * @return true if the iteration stalled in a way that suggests a pair of close or
         * complex roots near {@link #realShift}
         */
        private boolean realIterate(double start) {
            nz = 0;
            double s = start;
            double t = 0.0;
            double omp = 0.0;
            int steps = 0;
            while (true) {
                double pv = p[0];
                qp[0] = pv;
                for (int i = 1; i < nn; i++) {
                    pv = pv * s + p[i];
                    qp[i] = pv;
                }
                double mp = Math.abs(pv);
                double ms = Math.abs(s);
                double ee = 0.5 * Math.abs(qp[0]);
                for (int i = 1; i < nn; i++) {
                    ee = ee * ms + Math.abs(qp[i]);
                }
                // Rounding-error bound on evaluating p at s.
                if (mp <= 20.0 * ETA * (2.0 * ee - mp)) {
                    nz = 1;
                    szr = s;
                    szi = 0.0;
                    return false;
                }
                steps++;
                if (steps > 10) {
                    return false;
                }
                if (steps >= 2 && Math.abs(t) <= 0.001 * Math.abs(s - t) && mp >= omp) {
                    realShift = s;
                    return true;
                }
                omp = mp;
                double kv = k[0];
                qk[0] = kv;
                for (int i = 1; i < n; i++) {
                    kv = kv * s + k[i];
                    qk[i] = kv;
                }
                if (Math.abs(kv) > Math.abs(k[n - 1]) * 10.0 * ETA) {
                    double tt = -pv / kv;
                    k[0] = qp[0];
                    for (int i = 1; i < n; i++) {
                        k[i] = tt * qk[i - 1] + qp[i];
                    }
                } else {
                    k[0] = 0.0;
                    for (int i = 1; i < n; i++) {
                        k[i] = qk[i - 1];
                    }
                }
                kv = k[0];
                for (int i = 1; i < n; i++) {
                    kv = kv * s + k[i];
                }
                t = Math.abs(kv) > Math.abs(k[n - 1]) * 10.0 * ETA ? -pv / kv : 0.0;
                s += t;
            }
        }

        /**
         * Divides K by the current quadratic and derives the scalars used by
         * {@link #nextK} and {@link #estimateShift}.
         *
         * @return 3 when K is nearly divisible by the quadratic, otherwise 1 or 2 depending
         * on which remainder term is larger
         */
        private int scalars(double u, double v) {
            quadraticDivide(n, u, v, k, qk);
            c = nextA;
            d = nextB;
            if (Math.abs(c) <= Math.abs(k[n - 1]) * 100.0 * ETA && Math.abs(d) <= Math.abs(k[n - 2]) * 100.0 * ETA) {
                return 3;
            }
            h = v * b;
            if (Math.abs(d) >= Math.abs(c)) {
                e = a / d;
                f = c / d;
                g = u * b;
                a1 = f * b - a;
                a3 = e * (g + a) + h * (b / d);
                a7 = h + (f + u) * a;
                return 2;
            }
            e = a / c;
            f = d / c;
            g = e * u;
            a1 = b - a * (d / c);
            a3 = e * a + (g + h / c) * b;
            a7 = g * d + h * f + a;
            return 1;
        }

        private void nextK(int type) {
            if (type == 3) {
                k[0] = 0.0;
                k[1] = 0.0;
                for (int i = 2; i < n; i++) {
                    k[i] = qk[i - 2];
                }
                return;
            }
            double temp = type == 1 ? b : a;
            if (Math.abs(a1) > Math.abs(temp) * ETA * 10.0) {
                a7 /= a1;
                a3 /= a1;
                k[0] = qp[0];
                k[1] = qp[1] - a7 * qp[0];
                for (int i = 2; i < n; i++) {
                    k[i] = a3 * qk[i - 2] - a7 * qp[i - 1] + qp[i];
                }
            } else {
                // a1 is nearly zero: use the special form of the recurrence.
                k[0] = 0.0;
                k[1] = -a7 * qp[0];
                for (int i = 2; i < n; i++) {
                    k[i] = a3 * qk[i - 2] - a7 * qp[i - 1];
                }
            }
        }

        // New quadratic coefficients into nextU / nextV; both zero when no estimate exists.
        private void estimateShift(int type, double u, double v) {
            nextU = 0.0;
            nextV = 0.0;
            if (type == 3) {
                return;
            }
            double a4;
            double a5;
            if (type == 2) {
                a4 = (a + g) * f + h;
                a5 = (f + u) * c + v * d;
            } else {
                a4 = a + u * b + h * f;
                a5 = c + (u + v * f) * d;
            }
            double b1 = -k[n - 1] / p[n];
            double b2 = -(k[n - 2] + b1 * p[n - 1]) / p[n];
            double c1 = v * b2 * a1;
            double c2 = b1 * a7;
            double c3 = b1 * b1 * a3;
            double c4 = c1 - c2 - c3;
            double temp = a5 + b1 * a4 - c4;
            if (temp != 0.0) {
                nextU = u - (u * (c3 + c2) + v * (b1 * a1 + b2 * a7)) / temp;
                nextV = v * (1.0 + c4 / temp);
            }
        }

        /**
         * Divides the first {@code len} entries of {@code src} by {@code x^2 + ux + v} into
         * {@code quotient}; the remainder {@code a(x + u) + b} goes to nextA / nextB.
         */
        private void quadraticDivide(int len, double u, double v, double[] src, double[] quotient) {
            double bb = src[0];
            quotient[0] = bb;
            double aa = src[1] - u * bb;
            quotient[1] = aa;
            for (int i = 2; i < len; i++) {
                double cc = src[i] - (u * aa + v * bb);
                quotient[i] = cc;
                bb = aa;
                aa = cc;
            }
            nextA = aa;
            nextB = bb;
        }

        /**
         * Roots of {@code qa x^2 + qb x + qc} into (szr, szi) and (lzr, lzi), computed so as to
         * avoid overflow and cancellation. The smaller root goes first.
         */
        private void quadratic(double qa, double qb, double qc) {
            szr = 0.0;
            szi = 0.0;
            lzr = 0.0;
            lzi = 0.0;
            if (qa == 0.0) {
                if (qb != 0.0) {
                    szr = -qc / qb;
                }
                return;
            }
            if (qc == 0.0) {
                lzr = -qb / qa;
                return;
            }
            double half = qb / 2.0;
            double disc;
            double root;
            if (Math.abs(half) < Math.abs(qc)) {
                disc = qc >= 0.0 ? qa : -qa;
                disc = half * (half / Math.abs(qc)) - disc;
                root = Math.sqrt(Math.abs(disc)) * Math.sqrt(Math.abs(qc));
            } else {
                disc = 1.0 - (qa / half) * (qc / half);
                root = Math.sqrt(Math.abs(disc)) * Math.abs(half);
            }
            if (disc >= 0.0) {
                if (half >= 0.0) {
                    root = -root;
                }
                lzr = (root - half) / qa;
                if (lzr != 0.0) {
                    szr = qc / lzr / qa;
                }
            } else {
                szr = -half / qa;
                lzr = szr;
                szi = Math.abs(root / qa);
                lzi = -szi;
            }
        }
    }
}
