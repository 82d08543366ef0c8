package graph.matching;

/**
 * Result of a bipartite matching run.
 */
public final class Matching {

    private final int size;
    private final int[] matchOfLeft;
    private final int[] matchOfRight;

    Matching(int size, int[] matchOfLeft, int[] matchOfRight) {
        this.size = size;
        this.matchOfLeft = matchOfLeft;
        this.matchOfRight = matchOfRight;
    }

    public int size() {
        return size;
    }

    /**
     * Right node matched to left node {@code u}, or -1.
     */
    public int matchOfLeft(int u) {
        return matchOfLeft[u];
    }

    /**
     * Left node matched to right node {@code v}, or -1.
     */
    public int matchOfRight(int v) {
        return matchOfRight[v];
    }

    public int[] matchOfRight() {
        return matchOfRight.clone();
    }

    public int[] matchOfLeft() {
        return matchOfLeft.clone();
    }
}
