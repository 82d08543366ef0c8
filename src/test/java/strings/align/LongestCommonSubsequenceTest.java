package strings.align;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LongestCommonSubsequenceTest {

    @Test
    void classicExample() {
        assertEquals("mjau", LongestCommonSubsequence.dp("xmjyauz", "mzjawxu"));
        assertEquals(4, LongestCommonSubsequence.length("xmjyauz", "mzjawxu"));
        String h = LongestCommonSubsequence.hirschberg("xmjyauz", "mzjawxu");
        assertEquals(4, h.length());
        assertTrue(isSubsequence(h, "xmjyauz"));
        assertTrue(isSubsequence(h, "mzjawxu"));
        assertEquals(10, LongestCommonSubsequence.shortestCommonSupersequenceLength("xmjyauz", "mzjawxu"));
    }

    @Test
    void hirschbergAgreesWithTableOnRandomInputs() {
        Random rnd = new Random(99);
        for (int trial = 0; trial < 300; trial++) {
            String s1 = SequenceAlignmentTest.random(rnd, rnd.nextInt(20));
            String s2 = SequenceAlignmentTest.random(rnd, rnd.nextInt(20));
            String d = LongestCommonSubsequence.dp(s1, s2);
            String h = LongestCommonSubsequence.hirschberg(s1, s2);
            assertEquals(d.length(), h.length(), s1 + " / " + s2);
            assertEquals(d.length(), LongestCommonSubsequence.length(s1, s2));
            assertTrue(isSubsequence(h, s1) && isSubsequence(h, s2));
            assertTrue(isSubsequence(d, s1) && isSubsequence(d, s2));
        }
    }

    @Test
    void longestCommonSubstring() {
        assertEquals("babc", LongestCommonSubstring.of("bbbabca", "aababcd"));
        assertEquals("", LongestCommonSubstring.of("abc", ""));
    }

    private static boolean isSubsequence(String sub, String s) {
        int j = 0;
        for (int i = 0; i < s.length() && j < sub.length(); i++) {
            if (s.charAt(i) == sub.charAt(j)) {
                j++;
            }
        }
        return j == sub.length();
    }
}
