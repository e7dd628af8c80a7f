package com.orderflow.core;

/**
 * Receives the engine's events in the order they happen within a single
 * {@link MatchingEngine#submit(Order)} or {@link MatchingEngine#cancel(long)}.
 */
public interface MatchEventListener {

    void onTrade(Trade trade);

    /** The order (with its remaining quantity) is now resting in the book. */
    void onOrderAccepted(Order order);

    void onOrderRejected(Order order, ValidationResult reason);

    void onOrderCancelled(Order order);
}
