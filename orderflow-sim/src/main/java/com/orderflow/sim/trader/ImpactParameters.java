package com.orderflow.sim.trader;

import com.orderflow.core.signal.ImbalanceTracker;

/**
 * Tunables of the impact-sensitive strategy.
 *
 * <ul>
 * <li>{@code depth}: book levels the imbalance looks at.</li>
 * <li>{@code window}: number of recent ticks the imbalance is summed over.</li>
 * <li>{@code threshold}: volume-ratio magnitude above which the imbalance is
 * significant (filtered variant only).</li>
 * <li>{@code scale}, {@code decay}: map the accumulated imbalance to a price
 * offset, level <i>i</i> weighted by {@code decay^i}.</li>
 * <li>{@code aggression}: fraction of the distance to the shifted benchmark
 * the quote moves.</li>
 * <li>{@code endgameFraction}: remaining-session fraction below which the
 * trader crosses the spread when its limit allows.</li>
 * </ul>
 */
public final class ImpactParameters {

    public static final ImpactParameters DEFAULTS = new ImpactParameters(3, ImbalanceTracker.DEFAULT_WINDOW, 0.6,
            5.0, 0.8, 0.8, 0.3);

    private final int depth;
    private final int window;
    private final double threshold;
    private final double scale;
    private final double decay;
    private final double aggression;
    private final double endgameFraction;

    public ImpactParameters(int depth, int window, double threshold, double scale, double decay, double aggression,
            double endgameFraction) {
        this.depth = depth;
        this.window = window;
        this.threshold = threshold;
        this.scale = scale;
        this.decay = decay;
        this.aggression = aggression;
        this.endgameFraction = endgameFraction;
    }

    public int depth() {
        return depth;
    }

    public int window() {
        return window;
    }

    public double threshold() {
        return threshold;
    }

    public double scale() {
        return scale;
    }

    public double decay() {
        return decay;
    }

    public double aggression() {
        return aggression;
    }

    public double endgameFraction() {
        return endgameFraction;
    }

    @Override
    public String toString() {
        return "ImpactParameters{depth=" + depth + ", window=" + window + ", threshold=" + threshold + ", scale="
                + scale + ", decay=" + decay + ", aggression=" + aggression + ", endgame=" + endgameFraction + '}';
    }
}
