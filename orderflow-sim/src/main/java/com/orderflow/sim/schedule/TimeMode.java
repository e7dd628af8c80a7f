package com.orderflow.sim.schedule;

/**
 * How issue times of one replenishment are spread over the interval.
 */
public enum TimeMode {
    /** Everyone at the end of the interval. */
    PERIODIC,
    /** Evenly spaced. */
    DRIP_FIXED,
    /** Evenly spaced slots, random position within each slot. */
    DRIP_JITTER,
    /** Exponential inter-arrival times, squeezed to fit the interval. */
    DRIP_POISSON
}
