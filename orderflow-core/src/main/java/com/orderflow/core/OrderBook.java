package com.orderflow.core;

import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;
import org.agrona.collections.Long2ObjectHashMap;

import java.util.Collections;
import java.util.Iterator;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * <h1>The Order Book</h1>
 *
 * <p>
 * Resting bid and ask limit orders for a single instrument, kept in strict
 * price-time priority.
 * </p>
 *
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose</th>
 * </tr>
 * <tr>
 * <td><b>Lookup</b></td>
 * <td>{@link org.agrona.collections.Long2ObjectHashMap}</td>
 * <td>Primitive-keyed access to any resting order for cancels.</td>
 * </tr>
 * <tr>
 * <td><b>Ordering</b></td>
 * <td>{@link TreeMap} per side</td>
 * <td>Best-first iteration over {@link PriceLevel}s: bids descending, asks
 * ascending. Within a level, the intrusive FIFO gives arrival order.</td>
 * </tr>
 * </table>
 *
 * <h2>Concurrency Model: Single Writer</h2>
 * <p>
 * Not thread-safe. A book is owned by exactly one session and only mutated by
 * that session's {@link MatchingEngine}.
 * </p>
 *
 * <p>
 * Every mutation (insert, cancel, fill) bumps {@link #revision()}, which
 * stamps the {@link LevelSnapshot}s handed to the imbalance signal.
 * </p>
 */
public class OrderBook {

    private final NavigableMap<Long, PriceLevel> bids = new TreeMap<>(Collections.reverseOrder());
    private final NavigableMap<Long, PriceLevel> asks = new TreeMap<>();
    private final Long2ObjectHashMap<Order> ordersById = new Long2ObjectHashMap<>();

    private final Logger logger;

    private long revision;

    public OrderBook() {
        this(new Slf4jLogger(OrderBook.class));
    }

    public OrderBook(Logger logger) {
        this.logger = logger;
    }

    /**
     * Rests a limit order at its priority position.
     * <p>
     * Orders that would cross the opposite side are refused with
     * {@link ValidationResult#WOULD_CROSS}; marketable orders must go through
     * {@link MatchingEngine#submit(Order)}.
     * </p>
     */
    public ValidationResult insert(Order order) {
        ValidationResult result = OrderValidator.validate(order);
        if (result == ValidationResult.VALID && ordersById.containsKey(order.id())) {
            result = ValidationResult.DUPLICATE_ORDER_ID;
        }
        if (result == ValidationResult.VALID && crosses(order.side(), order.price())) {
            result = ValidationResult.WOULD_CROSS;
        }
        if (result != ValidationResult.VALID) {
            logger.warn("Insert rejected " + result + " for order", order.id());
            return result;
        }

        NavigableMap<Long, PriceLevel> sideMap = sideMap(order.side());
        PriceLevel level = sideMap.get(order.price());
        if (level == null) {
            level = new PriceLevel(order.price());
            sideMap.put(order.price(), level);
        }
        level.addOrder(order);
        ordersById.put(order.id(), order);
        revision++;
        return ValidationResult.VALID;
    }

    /**
     * Removes a resting order.
     *
     * @return false (and no state change) when the id is not resting, e.g.
     *         already filled or cancelled
     */
    public boolean cancel(long orderId) {
        return remove(orderId) != null;
    }

    Order remove(long orderId) {
        Order order = ordersById.remove(orderId);
        if (order == null) {
            logger.warn("Cancel ignored, order not found", orderId);
            return null;
        }
        NavigableMap<Long, PriceLevel> sideMap = sideMap(order.side());
        PriceLevel level = sideMap.get(order.price());
        level.removeOrder(order);
        if (level.isEmpty()) {
            sideMap.remove(order.price());
        }
        revision++;
        return order;
    }

    /**
     * Applies a fill to a resting order, removing it (and its level) once
     * fully filled.
     */
    void fill(Order resting, long qty) {
        NavigableMap<Long, PriceLevel> sideMap = sideMap(resting.side());
        PriceLevel level = sideMap.get(resting.price());
        level.fill(resting, qty);
        if (resting.isFilled()) {
            level.removeOrder(resting);
            ordersById.remove(resting.id());
            if (level.isEmpty()) {
                sideMap.remove(resting.price());
            }
        }
        revision++;
    }

    /** Best level on a side, or null when that side is empty. */
    PriceLevel bestLevel(byte side) {
        NavigableMap<Long, PriceLevel> sideMap = sideMap(side);
        return sideMap.isEmpty() ? null : sideMap.firstEntry().getValue();
    }

    boolean crosses(byte side, long price) {
        PriceLevel opposite = bestLevel(Side.opposite(side));
        if (opposite == null) {
            return false;
        }
        return side == Side.BUY ? price >= opposite.price() : price <= opposite.price();
    }

    public TopOfBook bestBid() {
        return TopOfBook.of(bestLevel(Side.BUY));
    }

    public TopOfBook bestAsk() {
        return TopOfBook.of(bestLevel(Side.SELL));
    }

    public TopOfBook best(byte side) {
        return TopOfBook.of(bestLevel(side));
    }

    /**
     * Aggregated top-of-book levels, best first, at most {@code depth} per
     * side.
     */
    public LevelSnapshot levels(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        long[] bidPrices = new long[Math.min(depth, bids.size())];
        long[] bidQuantities = new long[bidPrices.length];
        copyLevels(bids, bidPrices, bidQuantities);

        long[] askPrices = new long[Math.min(depth, asks.size())];
        long[] askQuantities = new long[askPrices.length];
        copyLevels(asks, askPrices, askQuantities);

        return new LevelSnapshot(revision, bidPrices, bidQuantities, askPrices, askQuantities);
    }

    private static void copyLevels(NavigableMap<Long, PriceLevel> sideMap, long[] prices, long[] quantities) {
        Iterator<PriceLevel> it = sideMap.values().iterator();
        for (int i = 0; i < prices.length; i++) {
            PriceLevel level = it.next();
            prices[i] = level.price();
            quantities[i] = level.totalQuantity();
        }
    }

    /** The resting order with this id, or null. */
    public Order order(long orderId) {
        return ordersById.get(orderId);
    }

    public int orderCount() {
        return ordersById.size();
    }

    public int depth(byte side) {
        return sideMap(side).size();
    }

    public boolean isEmpty() {
        return ordersById.isEmpty();
    }

    public long revision() {
        return revision;
    }

    private NavigableMap<Long, PriceLevel> sideMap(byte side) {
        return side == Side.BUY ? bids : asks;
    }

    @Override
    public String toString() {
        return "OrderBook{bid=" + bestBid() + ", ask=" + bestAsk() + ", orders=" + orderCount()
                + ", rev=" + revision + '}';
    }
}
