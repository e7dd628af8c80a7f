package com.orderflow.sim;

/**
 * Lifecycle of a {@link MarketSession}. Transitions only move forward.
 */
public enum SessionState {
    OPEN,
    TRADING,
    CLOSED
}
