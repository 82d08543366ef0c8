package strings.parse;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionParserTest {

    @Test
    void evaluatesWithPrecedence() {
        assertEquals(2.0, ExpressionParser.eval("1++1"));
        assertEquals(-63.0, ExpressionParser.eval("1+2*3*4+3*(2+2)-100"));
        assertEquals(7.0, ExpressionParser.eval(" 1 + 2 * 3 "));
        assertEquals(2.5, ExpressionParser.eval("10 / 4"));
        assertEquals(0.25, ExpressionParser.eval(".25"));
    }

    @Test
    void unaryAndPower() {
        assertEquals(-4.0, ExpressionParser.eval("-2^2"));
        assertEquals(512.0, ExpressionParser.eval("2^3^2"));
        assertEquals(0.5, ExpressionParser.eval("2^-1"));
        assertEquals(3.0, ExpressionParser.eval("--3"));
    }

    @Test
    void divisionByZeroFollowsFloatingPoint() {
        assertEquals(Double.POSITIVE_INFINITY, ExpressionParser.eval("1/0"));
        assertTrue(Double.isNaN(ExpressionParser.eval("0/0")));
    }

    @Test
    void rejectsMalformedInput() {
        for (String bad : new String[]{"", "1+", "(1+2", "1+2)", "2x", "1.2.3", "()", "3 4"}) {
            AlgorithmException e = assertThrows(AlgorithmException.class, () -> ExpressionParser.eval(bad), bad);
            assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT, e.kind());
        }
    }
}
