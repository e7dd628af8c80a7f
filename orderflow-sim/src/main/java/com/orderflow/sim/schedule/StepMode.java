package com.orderflow.sim.schedule;

/**
 * How limit prices are spread over a supply or demand range.
 */
public enum StepMode {
    /** Evenly spaced from the low to the high end. */
    FIXED,
    /** Evenly spaced, each moved by up to half a step either way. */
    JITTERED,
    /** Uniformly random within the range. */
    RANDOM
}
