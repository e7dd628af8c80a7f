package com.orderflow.core.signal;

import com.orderflow.core.LevelSnapshot;

/**
 * <h1>Multi-Level Order-Flow Imbalance (MLOFI)</h1>
 *
 * <p>
 * Pure functions over {@link LevelSnapshot}s. For level <i>i</i>, with primes
 * denoting the previous snapshot:
 * </p>
 *
 * <pre>
 *   bid flow  w = r        if b &gt; b'      (bid price rose: the whole level is new)
 *               = r - r'   if b == b'
 *               = -r'      if b &lt; b'      (level left the book)
 *
 *   ask flow  v = -q'      if a &gt; a'
 *               = q - q'   if a == a'
 *               = q        if a &lt; a'
 *
 *   e(i) = w - v
 * </pre>
 *
 * <p>
 * Positive values mean net buying pressure. Levels deeper than the book
 * count as price 0 and quantity 0.
 * </p>
 */
public final class ImbalanceSignal {

    private ImbalanceSignal() {
    }

    /**
     * Signed imbalance at one zero-based level.
     */
    public static long levelImbalance(LevelSnapshot previous, LevelSnapshot current, int level) {
        long bidPrice = current.bidPrice(level);
        long bidQty = current.bidQuantity(level);
        long prevBidPrice = previous.bidPrice(level);
        long prevBidQty = previous.bidQuantity(level);

        long bidFlow;
        if (bidPrice > prevBidPrice) {
            bidFlow = bidQty;
        } else if (bidPrice == prevBidPrice) {
            bidFlow = bidQty - prevBidQty;
        } else {
            bidFlow = -prevBidQty;
        }

        long askPrice = current.askPrice(level);
        long askQty = current.askQuantity(level);
        long prevAskPrice = previous.askPrice(level);
        long prevAskQty = previous.askQuantity(level);

        long askFlow;
        if (askPrice > prevAskPrice) {
            askFlow = -prevAskQty;
        } else if (askPrice == prevAskPrice) {
            askFlow = askQty - prevAskQty;
        } else {
            askFlow = askQty;
        }

        return bidFlow - askFlow;
    }

    /**
     * Per-level imbalance for levels 1..depth. With no previous snapshot the
     * sample is all zeros.
     */
    public static ImbalanceSample sample(LevelSnapshot previous, LevelSnapshot current, int depth) {
        checkDepth(depth);
        long[] levels = new long[depth];
        if (previous != null) {
            for (int i = 0; i < depth; i++) {
                levels[i] = levelImbalance(previous, current, i);
            }
        }
        return new ImbalanceSample(current.revision(), levels);
    }

    /**
     * The MLOFI value of two consecutive snapshots: the sum of the per-level
     * imbalances down to {@code depth}. Zero on the first snapshot.
     */
    public static long imbalanceAlter(LevelSnapshot previous, LevelSnapshot current, int depth) {
        return sample(previous, current, depth).aggregate();
    }

    /**
     * True when the magnitude of {@code value} is strictly above the noise
     * threshold.
     */
    public static boolean isImbalanceSignificant(double value, double threshold) {
        return Math.abs(value) > threshold;
    }

    /**
     * Depth-weighted bid/ask volume ratio in [-1, 1]. Level <i>i</i> is weighted
     * by {@code exp(-0.5 i)} and every level volume is offset by one so an
     * empty book reads as balanced.
     */
    public static double volumeRatio(double[] bidVolumes, double[] askVolumes) {
        if (bidVolumes.length != askVolumes.length) {
            throw new IllegalArgumentException("bid and ask volumes differ in depth");
        }
        double weightedBid = 0;
        double weightedAsk = 0;
        for (int i = 0; i < bidVolumes.length; i++) {
            double weight = Math.exp(-0.5 * i);
            weightedBid += weight * (bidVolumes[i] + 1);
            weightedAsk += weight * (askVolumes[i] + 1);
        }
        double total = weightedBid + weightedAsk;
        return total == 0 ? 0 : (weightedBid - weightedAsk) / total;
    }

    static void checkDepth(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("imbalance depth must be positive: " + depth);
        }
    }
}
