package com.orderflow.sim.trader;

import com.orderflow.core.Trade;
import com.orderflow.core.ValidationResult;
import com.orderflow.sim.MarketView;

/**
 * <b>The Trader Capability Contract.</b>
 * <p>
 * Every strategy variant is driven by the {@link com.orderflow.sim.MarketSession}
 * through these calls, always from the session's single thread:
 * </p>
 * <ol>
 * <li>{@link #assign(CustomerAssignment)} when the customer schedule issues a
 * new order to work.</li>
 * <li>{@link #decide(MarketView)} when the trader is picked for the tick.</li>
 * <li>{@link #onFill(Trade, byte)} / {@link #onReject(Quote, ValidationResult)}
 * as the quote is processed.</li>
 * <li>{@link #respond(MarketView)} after every tick, picked or not.</li>
 * </ol>
 */
public interface Trader {

    String id();

    TraderType type();

    void assign(CustomerAssignment assignment);

    /** The assignment being worked, or null when idle. */
    CustomerAssignment assignment();

    /**
     * @return the quote to submit, or null to stay out of the market this tick
     */
    Quote decide(MarketView view);

    void respond(MarketView view);

    /**
     * One of this trader's orders traded.
     *
     * @param side the side this trader was on
     */
    void onFill(Trade trade, byte side);

    void onReject(Quote quote, ValidationResult reason);

    /** Accumulated profit over all fills. */
    long balance();

    int tradeCount();
}
