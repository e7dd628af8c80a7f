package com.orderflow.core.signal;

import com.orderflow.core.LevelSnapshot;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * <h1>Rolling Imbalance Window</h1>
 *
 * <p>
 * Feeds consecutive {@link LevelSnapshot}s of one book through
 * {@link ImbalanceSignal} and keeps the last {@code window} observations of:
 * </p>
 * <ul>
 * <li>the per-level MLOFI sample,</li>
 * <li>the per-level depth {@code (bidQty + askQty) / 2},</li>
 * <li>the per-level bid and ask volumes.</li>
 * </ul>
 *
 * <p>
 * From these it derives the two inputs of the impact-sensitive quote: the
 * depth-weighted {@link #volumeRatio() volume ratio} used as a noise filter,
 * and the {@link #priceOffset(double, double) price offset} added to the mid.
 * </p>
 *
 * <p>
 * Not thread-safe; each trader owns its own tracker.
 * </p>
 */
public class ImbalanceTracker {

    public static final int DEFAULT_WINDOW = 10;

    private final int depth;
    private final int window;

    private final ArrayDeque<ImbalanceSample> samples = new ArrayDeque<>();
    private final ArrayDeque<double[]> depths = new ArrayDeque<>();
    private final ArrayDeque<long[]> bidVolumes = new ArrayDeque<>();
    private final ArrayDeque<long[]> askVolumes = new ArrayDeque<>();

    private LevelSnapshot previous;

    public ImbalanceTracker(int depth) {
        this(depth, DEFAULT_WINDOW);
    }

    public ImbalanceTracker(int depth, int window) {
        ImbalanceSignal.checkDepth(depth);
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.depth = depth;
        this.window = window;
    }

    /**
     * Records a new snapshot, normally once per tick. The first snapshot only
     * primes the tracker. An unchanged book still records a zero sample, so
     * quiet ticks dilute the window.
     *
     * @return the sample against the previous snapshot, or null on the first
     *         call
     */
    public ImbalanceSample update(LevelSnapshot current) {
        if (previous == null) {
            previous = current;
            return null;
        }

        ImbalanceSample sample = ImbalanceSignal.sample(previous, current, depth);
        double[] levelDepth = new double[depth];
        long[] bids = new long[depth];
        long[] asks = new long[depth];
        for (int i = 0; i < depth; i++) {
            bids[i] = current.bidQuantity(i);
            asks[i] = current.askQuantity(i);
            levelDepth[i] = (bids[i] + asks[i]) / 2.0;
        }

        push(samples, sample);
        push(depths, levelDepth);
        push(bidVolumes, bids);
        push(askVolumes, asks);
        previous = current;
        return sample;
    }

    private <T> void push(ArrayDeque<T> deque, T value) {
        deque.addLast(value);
        if (deque.size() > window) {
            deque.removeFirst();
        }
    }

    /** True once at least one sample has been recorded. */
    public boolean hasSignal() {
        return !samples.isEmpty();
    }

    public int sampleCount() {
        return samples.size();
    }

    public ImbalanceSample latestSample() {
        return samples.peekLast();
    }

    /** Sum over the window of the MLOFI at one zero-based level. */
    public long cumulativeImbalance(int level) {
        long sum = 0;
        for (ImbalanceSample sample : samples) {
            sum += sample.level(level);
        }
        return sum;
    }

    public double meanDepth(int level) {
        if (depths.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double[] d : depths) {
            sum += d[level];
        }
        return sum / depths.size();
    }

    /**
     * Depth-weighted bid/ask volume ratio over the window, in [-1, 1].
     * Positive when bids dominate.
     */
    public double volumeRatio() {
        return ImbalanceSignal.volumeRatio(meanVolumes(bidVolumes), meanVolumes(askVolumes));
    }

    private double[] meanVolumes(ArrayDeque<long[]> volumes) {
        double[] mean = new double[depth];
        if (volumes.isEmpty()) {
            return mean;
        }
        Iterator<long[]> it = volumes.iterator();
        while (it.hasNext()) {
            long[] v = it.next();
            for (int i = 0; i < depth; i++) {
                mean[i] += v[i];
            }
        }
        for (int i = 0; i < depth; i++) {
            mean[i] /= volumes.size();
        }
        return mean;
    }

    /**
     * Price shift implied by the accumulated imbalance:
     * {@code sum_i trunc(cumMLOFI_i * scale * decay^i / (meanDepth_i + 1))}.
     * Deeper levels count less through {@code decay}; thick levels damp the
     * shift through the depth divisor.
     */
    public long priceOffset(double scale, double decay) {
        long offset = 0;
        double weight = 1.0;
        for (int i = 0; i < depth; i++) {
            offset += (long) (cumulativeImbalance(i) * scale * weight / (meanDepth(i) + 1));
            weight *= decay;
        }
        return offset;
    }

    public int depth() {
        return depth;
    }

    public int window() {
        return window;
    }

    public void reset() {
        samples.clear();
        depths.clear();
        bidVolumes.clear();
        askVolumes.clear();
        previous = null;
    }
}
