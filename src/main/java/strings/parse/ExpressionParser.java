package strings.parse;

import utilities.AlgorithmException;

/**
 * Recursive-descent evaluator for arithmetic expressions.
 *
 * <pre>
 * expression ::= term (('+' | '-') term)*
 * term       ::= factor (('*' | '/') factor)*
 * factor     ::= ('+' | '-') factor | power
 * power      ::= primary ('^' factor)?
 * primary    ::= number | '(' expression ')'
 * </pre>
 *
 * <p>Numbers are decimal literals such as {@code 12}, {@code 3.5} or {@code .25}. Whitespace is
 * ignored. Exponentiation is right-associative. Arithmetic is IEEE-754 double, so division by
 * zero yields an infinity rather than an error.</p>
 */
public final class ExpressionParser {

    private static final char END = '\0';
    private static final char NUMBER = 'n';

    private final String s;
    private int pos;
    private char token;
    private double tokenValue;
    private int tokenStart;

    private ExpressionParser(String s) {
        this.s = s;
    }

    /**
     * @throws AlgorithmException with kind {@code INVALID_ARGUMENT} on an unknown character,
     * a malformed number, an unmatched parenthesis or trailing input
     */
    public static double eval(String expression) {
        if (expression == null) {
            throw AlgorithmException.invalidArgument("expression must be non-null");
        }
        ExpressionParser p = new ExpressionParser(expression);
        p.next();
        double value = p.expression();
        if (p.token != END) {
            throw p.error("unexpected '" + p.token + "'");
        }
        return value;
    }

    private void next() {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
            pos++;
        }
        tokenStart = pos;
        if (pos == s.length()) {
            token = END;
            return;
        }
        char c = s.charAt(pos);
        if ("+-*/^()".indexOf(c) >= 0) {
            pos++;
            token = c;
            return;
        }
        if (Character.isDigit(c) || c == '.') {
            int start = pos;
            while (pos < s.length() && (Character.isDigit(s.charAt(pos)) || s.charAt(pos) == '.')) {
                pos++;
            }
            String literal = s.substring(start, pos);
            try {
                tokenValue = Double.parseDouble(literal);
            } catch (NumberFormatException e) {
                throw error("malformed number '" + literal + "'");
            }
            token = NUMBER;
            return;
        }
        throw error("unknown character '" + c + "'");
    }

    private void expect(char expected) {
        if (token != expected) {
            throw error(token == END ? "expected '" + expected + "' before end of input"
                    : "expected '" + expected + "' but found '" + token + "'");
        }
        next();
    }

    private double expression() {
        double v = term();
        while (true) {
            if (token == '+') {
                next();
                v += term();
            } else if (token == '-') {
                next();
                v -= term();
            } else {
                return v;
            }
        }
    }

    private double term() {
        double v = factor();
        while (true) {
            if (token == '*') {
                next();
                v *= factor();
            } else if (token == '/') {
                next();
                v /= factor();
            } else {
                return v;
            }
        }
    }

    private double factor() {
        if (token == '+') {
            next();
            return factor();
        }
        if (token == '-') {
            next();
            return -factor();
        }
        double base = primary();
        if (token == '^') {
            next();
            return Math.pow(base, factor());
        }
        return base;
    }

    private double primary() {
        if (token == NUMBER) {
            double v = tokenValue;
            next();
            return v;
        }
        if (token == '(') {
            next();
            double v = expression();
            expect(')');
            return v;
        }
        throw error(token == END ? "unexpected end of input" : "unexpected '" + token + "'");
    }

    private AlgorithmException error(String detail) {
        return AlgorithmException.invalidArgument("%s at position %d in \"%s\"", detail, tokenStart, s);
    }
}
