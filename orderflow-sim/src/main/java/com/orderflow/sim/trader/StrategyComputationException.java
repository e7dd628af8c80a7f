package com.orderflow.sim.trader;

/**
 * A trader's pricing logic could not produce a usable quote. The session
 * treats the trader's action for that tick as "no order".
 */
public class StrategyComputationException extends RuntimeException {

    public StrategyComputationException(String message) {
        super(message);
    }

    public StrategyComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
