package com.orderflow.core;

/**
 * Best price and the aggregate quantity resting at it. An empty side is
 * reported as {@link #EMPTY}, never as null.
 */
public final class TopOfBook {

    public static final TopOfBook EMPTY = new TopOfBook(0, 0);

    private final long price;
    private final long quantity;

    private TopOfBook(long price, long quantity) {
        this.price = price;
        this.quantity = quantity;
    }

    static TopOfBook of(PriceLevel level) {
        return level == null ? EMPTY : new TopOfBook(level.price(), level.totalQuantity());
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    @Override
    public String toString() {
        return isEmpty() ? "TopOfBook{EMPTY}" : "TopOfBook{" + quantity + "@" + price + '}';
    }
}
