package utilities;

import java.util.Locale;

/**
 * Unchecked failure raised by every kernel in this library.
 *
 * <p>The {@link Kind} tells callers what went wrong without parsing the message:
 * bad input, a 64-bit overflow in modular arithmetic, a numeric method that ran out
 * of iterations, or a negative cycle reachable in a shortest-path query.</p>
 */
public final class AlgorithmException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_ARGUMENT,
        OVERFLOW,
        DOES_NOT_CONVERGE,
        NEGATIVE_CYCLE
    }

    private final Kind kind;

    public AlgorithmException(Kind kind, String detail) {
        super(kind + ": " + detail);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static AlgorithmException invalidArgument(String format, Object... args) {
        return new AlgorithmException(Kind.INVALID_ARGUMENT, String.format(Locale.ROOT, format, args));
    }

    public static AlgorithmException overflow(String format, Object... args) {
        return new AlgorithmException(Kind.OVERFLOW, String.format(Locale.ROOT, format, args));
    }

    public static AlgorithmException doesNotConverge(String format, Object... args) {
        return new AlgorithmException(Kind.DOES_NOT_CONVERGE, String.format(Locale.ROOT, format, args));
    }

    public static AlgorithmException negativeCycle(String format, Object... args) {
        return new AlgorithmException(Kind.NEGATIVE_CYCLE, String.format(Locale.ROOT, format, args));
    }
}
