package automaton;

import java.util.Objects;

// Immutable configuration for constructing AhoCorasick instances.
public final class AutomatonConfiguration {

    /** Order in which freed arena slots are handed out again. */
    public enum RecyclePolicy {
        LIFO,
        FIFO
    }

    private static final AutomatonConfiguration DEFAULTS = builder().build();

    private final int initialCapacity;
    private final int expectedAlphabetSize;
    private final RecyclePolicy recyclePolicy;
    private final boolean collectStats;

    private AutomatonConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.expectedAlphabetSize = builder.expectedAlphabetSize;
        this.recyclePolicy = builder.recyclePolicy;
        this.collectStats = builder.collectStats;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static AutomatonConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        if (expectedAlphabetSize <= 0) {
            throw new IllegalArgumentException("expectedAlphabetSize must be positive");
        }
    }

    public int initialCapacity() { return initialCapacity; }
    public int expectedAlphabetSize() { return expectedAlphabetSize; }
    public RecyclePolicy recyclePolicy() { return recyclePolicy; }
    public boolean collectStats() { return collectStats; }

    public Builder toBuilder() {
        return new Builder()
                .initialCapacity(initialCapacity)
                .expectedAlphabetSize(expectedAlphabetSize)
                .recyclePolicy(recyclePolicy)
                .collectStats(collectStats);
    }

    public static final class Builder {
        private int initialCapacity = 16;
        private int expectedAlphabetSize = 4;
        private RecyclePolicy recyclePolicy = RecyclePolicy.LIFO;
        private boolean collectStats;

        private Builder() {
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        // Sizes each node's child map; small values suit sparse tries.
        public Builder expectedAlphabetSize(int expectedAlphabetSize) {
            this.expectedAlphabetSize = expectedAlphabetSize;
            return this;
        }

        public Builder recyclePolicy(RecyclePolicy recyclePolicy) {
            this.recyclePolicy = Objects.requireNonNull(recyclePolicy, "recyclePolicy");
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(this);
        }
    }
}
