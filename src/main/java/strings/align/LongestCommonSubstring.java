package strings.align;

import strings.suffix.SuffixAutomaton;
import utilities.AlgorithmException;

/**
 * Longest common substring, by walking the second string through the suffix automaton of
 * the first. Linear in the total length.
 */
public final class LongestCommonSubstring {

    private LongestCommonSubstring() {
    }

    /**
     * @return a longest string occurring in both inputs, taken from its leftmost end in
     * {@code s2}; empty if they share no character
     */
    public static String of(String s1, String s2) {
        if (s1 == null || s2 == null) {
            throw AlgorithmException.invalidArgument("strings must be non-null");
        }
        return new SuffixAutomaton(s1).longestCommonSubstring(s2);
    }
}
