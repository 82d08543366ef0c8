package numerics.roots;

import utilities.AlgorithmException;

// Immutable tunables for the iterative root finders.
public final class RootFinderOptions {

    public static final double DEFAULT_EPSILON = 1e-15;
    public static final int DEFAULT_MAX_ITERATIONS = 10000;
    public static final long DEFAULT_SEED = 0x5DEECE66DL;

    private final double epsilon;
    private final int maxIterations;
    private final long seed;

    private RootFinderOptions(Builder builder) {
        this.epsilon = builder.epsilon;
        this.maxIterations = builder.maxIterations;
        this.seed = builder.seed;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static RootFinderOptions defaults() { return new Builder().build(); }

    private void validate() {
        if (!(epsilon > 0.0) || Double.isInfinite(epsilon)) {
            throw AlgorithmException.invalidArgument("epsilon must be positive and finite, got %s", epsilon);
        }
        if (maxIterations <= 0) {
            throw AlgorithmException.invalidArgument("maxIterations must be positive, got %d", maxIterations);
        }
    }

    public double epsilon() { return epsilon; }
    public int maxIterations() { return maxIterations; }
    public long seed() { return seed; }

    public static final class Builder {
        private double epsilon = DEFAULT_EPSILON;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private long seed = DEFAULT_SEED;

        private Builder() {
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public RootFinderOptions build() {
            return new RootFinderOptions(this);
        }
    }
}
