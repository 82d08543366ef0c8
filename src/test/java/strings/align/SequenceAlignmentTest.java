package strings.align;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SequenceAlignmentTest {

    @Test
    void alignsWithGapAndSubstitution() {
        Alignment a = SequenceAlignment.align("AGGGCT", "AGGCA", 2, 3);
        assertEquals(new Alignment("AGGGCT", "A_GGCA"), a);
        assertEquals(5L, a.cost(2, 3));
        assertEquals(5L, SequenceAlignment.cost("AGGGCT", "AGGCA", 2, 3));
    }

    @Test
    void hirschbergReachesTheOptimalCost() {
        Alignment a = SequenceAlignment.hirschberg("AGGGCT", "AGGCA", 2, 3);
        assertEquals(5L, a.cost(2, 3));
        assertEquals("AGGGCT", strip(a.first()));
        assertEquals("AGGCA", strip(a.second()));
    }

    @Test
    void prefersTwoGapsOverAnExpensiveSubstitution() {
        Alignment a = SequenceAlignment.align("A", "B", 1, 5);
        assertEquals(2L, a.cost(1, 5));
        assertEquals(2L, SequenceAlignment.hirschberg("A", "B", 1, 5).cost(1, 5));
        assertEquals(2L, SequenceAlignment.hirschberg("XAY", "XBY", 1, 5).cost(1, 5));
    }

    @Test
    void emptyInputsAlignAgainstGaps() {
        assertEquals(new Alignment("___", "abc"), SequenceAlignment.align("", "abc", 1, 1));
        assertEquals(new Alignment("abc", "___"), SequenceAlignment.hirschberg("abc", "", 1, 1));
        assertEquals(new Alignment("", ""), SequenceAlignment.hirschberg("", "", 1, 1));
    }

    @Test
    void hirschbergAgreesWithFullTableOnRandomInputs() {
        Random rnd = new Random(5);
        for (int trial = 0; trial < 300; trial++) {
            String s1 = random(rnd, rnd.nextInt(15));
            String s2 = random(rnd, rnd.nextInt(15));
            int gap = 1 + rnd.nextInt(4);
            int sub = 1 + rnd.nextInt(6);
            long expected = SequenceAlignment.align(s1, s2, gap, sub).cost(gap, sub);
            assertEquals(expected, SequenceAlignment.cost(s1, s2, gap, sub));
            Alignment h = SequenceAlignment.hirschberg(s1, s2, gap, sub);
            assertEquals(expected, h.cost(gap, sub), s1 + " / " + s2);
            assertEquals(s1, strip(h.first()));
            assertEquals(s2, strip(h.second()));
        }
    }

    @Test
    void rejectsNegativeCostsAndGapCharacters() {
        assertThrows(AlgorithmException.class, () -> SequenceAlignment.align("a", "b", -1, 1));
        assertThrows(AlgorithmException.class, () -> SequenceAlignment.align("a_", "b", 1, 1));
    }

    @Test
    void levenshtein() {
        assertEquals(3, EditDistance.levenshtein("kitten", "sitting"));
        assertEquals(0, EditDistance.levenshtein("", ""));
        assertEquals(4, EditDistance.levenshtein("", "abcd"));
        assertEquals(SequenceAlignment.cost("flaw", "lawn", 1, 1), EditDistance.levenshtein("flaw", "lawn"));
    }

    @Test
    void alignmentRowsMustHaveEqualLength() {
        AlgorithmException e = assertThrows(AlgorithmException.class, () -> new Alignment("ab", "a"));
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT, e.kind());
        assertThrows(AlgorithmException.class, () -> new Alignment(null, ""));
    }

    static String random(Random rnd, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + rnd.nextInt(3)));
        }
        return sb.toString();
    }

    private static String strip(String row) {
        return row.replace(String.valueOf(Alignment.GAP), "");
    }
}
