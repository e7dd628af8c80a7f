package com.orderflow.core;

/**
 * A limit order as it rests in the {@link OrderBook}.
 * <p>
 * Everything but the remaining quantity is fixed at construction. The
 * quantity only ever goes down, through fills applied by the
 * {@link MatchingEngine}.
 * </p>
 */
public final class Order {

    private final long id;
    private final byte side;
    private final long price;
    private final long originalQuantity;
    private final String traderId;
    private final long timestamp;

    private long quantity;

    // For intrusive linked lists in PriceLevels
    Order next;
    Order prev;

    public Order(long id, byte side, long price, long quantity, String traderId, long timestamp) {
        this.id = id;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.originalQuantity = quantity;
        this.traderId = traderId;
        this.timestamp = timestamp;
    }

    public long id() {
        return id;
    }

    public byte side() {
        return side;
    }

    public long price() {
        return price;
    }

    /** Remaining (unfilled) quantity. */
    public long quantity() {
        return quantity;
    }

    public long originalQuantity() {
        return originalQuantity;
    }

    public long filledQuantity() {
        return originalQuantity - quantity;
    }

    public String traderId() {
        return traderId;
    }

    public long timestamp() {
        return timestamp;
    }

    public boolean isFilled() {
        return quantity == 0;
    }

    void reduce(long qty) {
        if (qty <= 0 || qty > quantity) {
            throw new IllegalArgumentException("Cannot reduce order " + id + " by " + qty + ", remaining " + quantity);
        }
        quantity -= qty;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", side=" + Side.name(side) +
                ", price=" + price +
                ", quantity=" + quantity +
                ", trader=" + traderId +
                ", t=" + timestamp +
                '}';
    }
}
