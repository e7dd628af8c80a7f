package com.orderflow.sim.trader;

import com.orderflow.core.Side;

/**
 * A customer order handed to a trader: buy or sell up to {@code quantity}
 * at a price no worse than {@code limitPrice}.
 * <p>
 * The limit is the trader's private valuation. Fills are scored against it,
 * never against the quoted price.
 * </p>
 */
public final class CustomerAssignment {

    private final byte side;
    private final long limitPrice;
    private final long quantity;
    private final long issueTick;

    public CustomerAssignment(byte side, long limitPrice, long quantity, long issueTick) {
        if (!Side.isKnown(side)) {
            throw new IllegalArgumentException("Unknown side " + side);
        }
        if (limitPrice <= 0 || quantity <= 0) {
            throw new IllegalArgumentException("Assignment needs a positive limit and quantity");
        }
        this.side = side;
        this.limitPrice = limitPrice;
        this.quantity = quantity;
        this.issueTick = issueTick;
    }

    public byte side() {
        return side;
    }

    public long limitPrice() {
        return limitPrice;
    }

    public long quantity() {
        return quantity;
    }

    public long issueTick() {
        return issueTick;
    }

    /** Surplus earned by filling {@code qty} at {@code price} against this limit. */
    public long profit(long price, long qty) {
        return side == Side.BUY ? (limitPrice - price) * qty : (price - limitPrice) * qty;
    }

    @Override
    public String toString() {
        return "CustomerAssignment{" + Side.name(side) + " " + quantity + "@" + limitPrice + ", t=" + issueTick + '}';
    }
}
