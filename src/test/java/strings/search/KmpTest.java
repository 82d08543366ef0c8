package strings.search;

import org.junit.jupiter.api.Test;
import utilities.AlgorithmException;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KmpTest {

    @Test
    void findsFirstMatchInTheClassicExample() {
        assertEquals(15, Kmp.findFirst("ABC ABCDAB ABCDABCDABDE", "ABCDABD"));
        assertEquals(List.of(15), Kmp.search("ABC ABCDAB ABCDABCDABDE", "ABCDABD"));
    }

    @Test
    void failureTableHasOneEntryPerPrefixLength() {
        assertArrayEquals(new int[]{0, 0, 0, 0, 0, 1, 2, 0}, Kmp.failureTable("ABCDABD"));
        assertArrayEquals(new int[]{0, 0, 1, 2, 3}, Kmp.failureTable("aaaa"));
    }

    @Test
    void reportsOverlappingMatches() {
        assertEquals(List.of(0, 1, 2), Kmp.search("aaaa", "aa"));
        assertEquals(List.of(0, 2), Kmp.search("ababa", "aba"));
        assertEquals(-1, Kmp.findFirst("abc", "abd"));
        assertEquals(List.of(), Kmp.search("ab", "abc"));
    }

    @Test
    void agreesWithNaiveAndZFunctionSearch() {
        Random rnd = new Random(1);
        for (int trial = 0; trial < 300; trial++) {
            String text = randomString(rnd, rnd.nextInt(40), 2);
            String pattern = randomString(rnd, 1 + rnd.nextInt(4), 2);
            List<Integer> expected = new java.util.ArrayList<>();
            for (int i = 0; i + pattern.length() <= text.length(); i++) {
                if (text.startsWith(pattern, i)) {
                    expected.add(i);
                }
            }
            assertEquals(expected, Kmp.search(text, pattern));
            assertEquals(expected, ZFunction.search(text, pattern));
            assertEquals(expected.isEmpty() ? -1 : expected.get(0), Kmp.findFirst(text, pattern));
        }
    }

    @Test
    void rejectsEmptyPattern() {
        AlgorithmException e = assertThrows(AlgorithmException.class, () -> Kmp.search("abc", ""));
        assertEquals(AlgorithmException.Kind.INVALID_ARGUMENT, e.kind());
    }

    static String randomString(Random rnd, int length, int alphabet) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + rnd.nextInt(alphabet)));
        }
        return sb.toString();
    }
}
