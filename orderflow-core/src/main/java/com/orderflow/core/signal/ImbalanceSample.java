package com.orderflow.core.signal;

/**
 * Order-flow imbalance between two consecutive snapshots of the same book:
 * one signed contribution per level plus their sum.
 */
public final class ImbalanceSample {

    private final long timestamp;
    private final long[] levels;
    private final long aggregate;

    ImbalanceSample(long timestamp, long[] levels) {
        this.timestamp = timestamp;
        this.levels = levels;
        long sum = 0;
        for (long level : levels) {
            sum += level;
        }
        this.aggregate = sum;
    }

    /** Revision of the later of the two snapshots. */
    public long timestamp() {
        return timestamp;
    }

    public int depth() {
        return levels.length;
    }

    /** Zero-based level index. */
    public long level(int level) {
        return levels[level];
    }

    public long[] levels() {
        return levels.clone();
    }

    /** The MLOFI value: sum of the per-level contributions. */
    public long aggregate() {
        return aggregate;
    }

    @Override
    public String toString() {
        return "ImbalanceSample{t=" + timestamp + ", mlofi=" + aggregate + ", levels=" + java.util.Arrays.toString(levels)
                + '}';
    }
}
