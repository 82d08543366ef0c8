package numerics.modular;

import utilities.AlgorithmException;

// Immutable tunables for Factorization.primeFactorizeBig.
public final class FactorizationOptions {

    public static final long DEFAULT_TRIAL_DIVISION_CUTOFF = 1_000_000L;
    public static final long DEFAULT_SEED = 0x2545F4914F6CDD1DL;

    private final long trialDivisionCutoff;
    private final long seed;

    private FactorizationOptions(Builder builder) {
        this.trialDivisionCutoff = builder.trialDivisionCutoff;
        this.seed = builder.seed;
        if (trialDivisionCutoff < 1L) {
            throw AlgorithmException.invalidArgument("trialDivisionCutoff must be at least 1, got %d", trialDivisionCutoff);
        }
    }

    public static Builder builder() { return new Builder(); }

    public static FactorizationOptions defaults() { return new Builder().build(); }

    public long trialDivisionCutoff() { return trialDivisionCutoff; }
    public long seed() { return seed; }

    public static final class Builder {
        private long trialDivisionCutoff = DEFAULT_TRIAL_DIVISION_CUTOFF;
        private long seed = DEFAULT_SEED;

        private Builder() {
        }

        /**
         * Largest candidate tried by trial division before switching to Pollard rho.
         */
        public Builder trialDivisionCutoff(long trialDivisionCutoff) {
            this.trialDivisionCutoff = trialDivisionCutoff;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public FactorizationOptions build() {
            return new FactorizationOptions(this);
        }
    }
}
