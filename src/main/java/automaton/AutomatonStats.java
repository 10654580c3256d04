package automaton;

/**
 * Collects optional counters for {@link AhoCorasick} without touching the hot path
 * when collection is disabled.
 */
public final class AutomatonStats {

    private boolean collectStats;
    private long wordsAdded;
    private long wordsRemoved;
    private long nodesAllocated;
    private long nodesReused;
    private long nodesFreed;
    private long linksResolved;
    private long invalidations;

    public AutomatonStats(boolean collectStats) {
        this.collectStats = collectStats;
    }

    AutomatonStats(AutomatonStats that) {
        this.collectStats = that.collectStats;
        this.wordsAdded = that.wordsAdded;
        this.wordsRemoved = that.wordsRemoved;
        this.nodesAllocated = that.nodesAllocated;
        this.nodesReused = that.nodesReused;
        this.nodesFreed = that.nodesFreed;
        this.linksResolved = that.linksResolved;
        this.invalidations = that.invalidations;
    }

    public boolean isCollecting() {
        return collectStats;
    }

    public void setCollecting(boolean collectStats) {
        this.collectStats = collectStats;
        if (!collectStats) {
            reset();
        }
    }

    public void reset() {
        wordsAdded = 0L;
        wordsRemoved = 0L;
        nodesAllocated = 0L;
        nodesReused = 0L;
        nodesFreed = 0L;
        linksResolved = 0L;
        invalidations = 0L;
    }

    void recordWordAdded() {
        if (collectStats) wordsAdded++;
    }

    void recordWordRemoved() {
        if (collectStats) wordsRemoved++;
    }

    void recordAllocation(boolean reused) {
        if (!collectStats) {
            return;
        }
        if (reused) {
            nodesReused++;
        } else {
            nodesAllocated++;
        }
    }

    void recordFree() {
        if (collectStats) nodesFreed++;
    }

    void recordLinkResolved() {
        if (collectStats) linksResolved++;
    }

    void recordInvalidation() {
        if (collectStats) invalidations++;
    }

    public long wordsAdded() { return wordsAdded; }
    public long wordsRemoved() { return wordsRemoved; }
    /** Slots appended to the arena. */
    public long nodesAllocated() { return nodesAllocated; }
    /** Slots taken from the free list. */
    public long nodesReused() { return nodesReused; }
    public long nodesFreed() { return nodesFreed; }
    public long linksResolved() { return linksResolved; }
    public long invalidations() { return invalidations; }

    /** Share of node allocations served from recycled slots. */
    public double reuseRatio() {
        long total = nodesAllocated + nodesReused;
        if (total == 0) {
            return 0.0;
        }
        return (double) nodesReused / total;
    }

    @Override
    public String toString() {
        return String.format("words(+%d/-%d) nodes(new=%d, reused=%d, freed=%d) links=%d invalidations=%d",
                wordsAdded, wordsRemoved, nodesAllocated, nodesReused, nodesFreed, linksResolved, invalidations);
    }
}
