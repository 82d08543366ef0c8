package strings.align;

import utilities.AlgorithmException;

import java.util.Objects;

/**
 * Two strings of equal length over the input alphabet plus the gap character {@link #GAP}.
 */
public final class Alignment {

    public static final char GAP = '_';

    private final String first;
    private final String second;

    public Alignment(String first, String second) {
        if (first == null || second == null) {
            throw AlgorithmException.invalidArgument("aligned rows must be non-null");
        }
        if (first.length() != second.length()) {
            throw AlgorithmException.invalidArgument("aligned rows differ in length: %d vs %d",
                    first.length(), second.length());
        }
        this.first = first;
        this.second = second;
    }

    public String first() {
        return first;
    }

    public String second() {
        return second;
    }

    /**
     * {@code gapCost} per gap in either row plus {@code subCost} per column holding two
     * different characters.
     */
    public long cost(int gapCost, int subCost) {
        long total = 0L;
        for (int i = 0; i < first.length(); i++) {
            char a = first.charAt(i);
            char b = second.charAt(i);
            if (a == GAP || b == GAP) {
                total += gapCost;
            } else if (a != b) {
                total += subCost;
            }
        }
        return total;
    }

    Alignment swapped() {
        return new Alignment(second, first);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Alignment)) {
            return false;
        }
        Alignment other = (Alignment) o;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + "\n" + second;
    }
}
