package com.orderflow.core;

/**
 * <b>The Price Level</b>
 * <p>
 * All resting orders at one price, kept as an intrusive FIFO list: the
 * {@link Order} itself carries the prev/next links, so the head is always the
 * earliest arrival and fills first.
 * </p>
 */
public final class PriceLevel {

    private final long price;
    private Order head;
    private Order tail;
    private long totalQuantity;
    private int orderCount;

    PriceLevel(long price) {
        this.price = price;
    }

    public long price() {
        return price;
    }

    public long totalQuantity() {
        return totalQuantity;
    }

    public int orderCount() {
        return orderCount;
    }

    /** Earliest resting order at this price, or null when the level is empty. */
    public Order head() {
        return head;
    }

    public boolean isEmpty() {
        return head == null;
    }

    void addOrder(Order order) {
        if (head == null) {
            head = order;
            tail = order;
            order.prev = null;
            order.next = null;
        } else {
            tail.next = order;
            order.prev = tail;
            order.next = null;
            tail = order;
        }
        totalQuantity += order.quantity();
        orderCount++;
    }

    /**
     * Removes the order from the level.
     * Note: This assumes the order is actually in this level.
     */
    void removeOrder(Order order) {
        if (order.prev != null) {
            order.prev.next = order.next;
        } else {
            head = order.next;
        }

        if (order.next != null) {
            order.next.prev = order.prev;
        } else {
            tail = order.prev;
        }

        totalQuantity -= order.quantity();
        orderCount--;
        order.next = null;
        order.prev = null;
    }

    void fill(Order order, long qty) {
        order.reduce(qty);
        totalQuantity -= qty;
    }
}
