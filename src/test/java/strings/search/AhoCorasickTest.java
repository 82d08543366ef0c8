package strings.search;

import org.junit.jupiter.api.Test;
import strings.search.AhoCorasick.Match;
import utilities.AlgorithmException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AhoCorasickTest {

    private static final List<String> WIKI = List.of("a", "ab", "bab", "bc", "bca", "c", "caa");

    @Test
    void reportsMatchesByEndPosition() {
        AhoCorasick ac = new AhoCorasick(WIKI);
        List<Match> expected = List.of(
                new Match(0, 0),
                new Match(1, 0),
                new Match(3, 1), new Match(5, 2),
                new Match(5, 3),
                new Match(0, 4),
                new Match(1, 4));
        assertEquals(expected, ac.search("abccab"));
    }

    @Test
    void duplicateNeedlesAreBothReported() {
        AhoCorasick ac = new AhoCorasick(List.of("ab", "ab"));
        assertEquals(List.of(new Match(0, 1), new Match(1, 1)), ac.search("xab"));
    }

    @Test
    void agreesWithIndependentKmpSearches() {
        Random rnd = new Random(13);
        for (int trial = 0; trial < 200; trial++) {
            List<String> needles = new ArrayList<>();
            int count = 1 + rnd.nextInt(6);
            for (int i = 0; i < count; i++) {
                needles.add(KmpTest.randomString(rnd, 1 + rnd.nextInt(4), 3));
            }
            String text = KmpTest.randomString(rnd, rnd.nextInt(60), 3);

            List<Match> expected = new ArrayList<>();
            for (int p = 0; p < needles.size(); p++) {
                for (int start : Kmp.search(text, needles.get(p))) {
                    expected.add(new Match(p, start));
                }
            }
            Comparator<Match> byEnd = Comparator
                    .comparingInt((Match m) -> m.start + needles.get(m.pattern).length())
                    .thenComparingInt(m -> m.pattern);
            expected.sort(byEnd);
            assertEquals(expected, new AhoCorasick(needles).search(text));
        }
    }

    @Test
    void buildingTwiceGivesTheSameAutomaton() {
        AhoCorasick a = new AhoCorasick(WIKI);
        AhoCorasick b = new AhoCorasick(WIKI);
        assertEquals(a.stateCount(), b.stateCount());
        for (int s = 0; s < a.stateCount(); s++) {
            assertEquals(a.transitions(s), b.transitions(s));
            assertEquals(a.failureLink(s), b.failureLink(s));
            assertArrayEquals(a.outputs(s), b.outputs(s));
        }
    }

    @Test
    void rejectsEmptyNeedle() {
        assertThrows(AlgorithmException.class, () -> new AhoCorasick(List.of("a", "")));
    }
}
