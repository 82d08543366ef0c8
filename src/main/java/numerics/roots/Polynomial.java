package numerics.roots;

import org.apache.commons.math3.complex.Complex;
import utilities.AlgorithmException;

import java.util.Arrays;

/**
 * Polynomial with real coefficients, stored lowest degree first: {@code c[i]} multiplies
 * {@code x^i}. Trailing zero coefficients are dropped, so the leading coefficient is
 * non-zero unless the polynomial is the constant zero.
 */
public final class Polynomial {

    private final double[] c;

    public Polynomial(double... coefficients) {
        if (coefficients == null || coefficients.length == 0) {
            throw AlgorithmException.invalidArgument("a polynomial needs at least one coefficient");
        }
        for (int i = 0; i < coefficients.length; i++) {
            if (!Double.isFinite(coefficients[i])) {
                throw AlgorithmException.invalidArgument("coefficient %d is not finite: %s", i, coefficients[i]);
            }
        }
        int len = coefficients.length;
        while (len > 1 && coefficients[len - 1] == 0.0) {
            len--;
        }
        this.c = Arrays.copyOf(coefficients, len);
    }

    /**
     * Monic polynomial whose roots are exactly {@code roots}, with multiplicity.
     */
    public static Polynomial fromRoots(double... roots) {
        Polynomial p = new Polynomial(1.0);
        for (double r : roots) {
            p = p.multiply(new Polynomial(-r, 1.0));
        }
        return p;
    }

    public int degree() {
        return c.length - 1;
    }

    public boolean isZero() {
        return c.length == 1 && c[0] == 0.0;
    }

    public double coefficient(int i) {
        return i < c.length ? c[i] : 0.0;
    }

    public double leadingCoefficient() {
        return c[c.length - 1];
    }

    public double[] coefficients() {
        return c.clone();
    }

    public Complex[] toComplex() {
        Complex[] out = new Complex[c.length];
        for (int i = 0; i < c.length; i++) {
            out[i] = new Complex(c[i]);
        }
        return out;
    }

    // Horner
    public double evaluate(double x) {
        double y = c[c.length - 1];
        for (int i = c.length - 2; i >= 0; i--) {
            y = y * x + c[i];
        }
        return y;
    }

    public Complex evaluate(Complex x) {
        Complex y = new Complex(c[c.length - 1]);
        for (int i = c.length - 2; i >= 0; i--) {
            y = y.multiply(x).add(c[i]);
        }
        return y;
    }

    public Polynomial derivative() {
        if (c.length == 1) {
            return new Polynomial(0.0);
        }
        double[] d = new double[c.length - 1];
        for (int i = 1; i < c.length; i++) {
            d[i - 1] = c[i] * i;
        }
        return new Polynomial(d);
    }

    public Polynomial multiply(Polynomial other) {
        double[] prod = new double[c.length + other.c.length - 1];
        for (int i = 0; i < c.length; i++) {
            for (int j = 0; j < other.c.length; j++) {
                prod[i + j] += c[i] * other.c[j];
            }
        }
        return new Polynomial(prod);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Polynomial)) {
            return false;
        }
        return Arrays.equals(c, ((Polynomial) o).c);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(c);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < c.length; i++) {
            if (i > 0) {
                sb.append(c[i] < 0 ? " - " : " + ");
                sb.append(Math.abs(c[i])).append("x^").append(i);
            } else {
                sb.append(c[i]);
            }
        }
        return sb.toString();
    }
}
