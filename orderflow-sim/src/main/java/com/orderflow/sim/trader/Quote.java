package com.orderflow.sim.trader;

import com.orderflow.core.Side;

/**
 * A trader's decision for one tick: a limit order still to be stamped with an
 * id and timestamp by the session.
 */
public final class Quote {

    private final byte side;
    private final long price;
    private final long quantity;

    public Quote(byte side, long price, long quantity) {
        this.side = side;
        this.price = price;
        this.quantity = quantity;
    }

    public byte side() {
        return side;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quote)) {
            return false;
        }
        Quote quote = (Quote) o;
        return side == quote.side && price == quote.price && quantity == quote.quantity;
    }

    @Override
    public int hashCode() {
        int result = side;
        result = 31 * result + Long.hashCode(price);
        result = 31 * result + Long.hashCode(quantity);
        return result;
    }

    @Override
    public String toString() {
        return "Quote{" + Side.name(side) + " " + quantity + "@" + price + '}';
    }
}
