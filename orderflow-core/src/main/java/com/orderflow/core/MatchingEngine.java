package com.orderflow.core;

import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;

import java.util.ArrayList;
import java.util.List;

/**
 * <h1>The Matching Engine</h1>
 *
 * <p>
 * The exchange's state machine: every order entering the market passes
 * through {@link #submit(Order)}, which is the only place {@link Trade}s are
 * created.
 * </p>
 *
 * <h3>Single-Threaded Execution</h3>
 * <p>
 * One order is matched to completion, cascading fills included, before the
 * next one is looked at. There are no locks and no suspension points; the
 * owning session serialises all input. Running the same inputs in the same
 * order always produces the same trades.
 * </p>
 *
 * <h3>Price-Time Priority, Resting-Price Execution</h3>
 * <p>
 * The incoming order walks the opposite side best level first and, within a
 * level, earliest arrival first. Each execution happens at the resting
 * order's price for the smaller of the two remaining quantities.
 * </p>
 */
public class MatchingEngine {

    private final OrderBook orderBook;
    private final MatchEventListener listener;
    private final Logger logger;

    private long tradeSequence;

    public MatchingEngine(MatchEventListener listener) {
        this(new OrderBook(), listener, new Slf4jLogger(MatchingEngine.class));
    }

    public MatchingEngine(OrderBook orderBook, MatchEventListener listener, Logger logger) {
        this.orderBook = orderBook;
        this.listener = listener;
        this.logger = logger;
    }

    /**
     * The core processor method.
     * <p>
     * <b>Logic Flow (The "Crossing the Spread" Algorithm):</b>
     * <ol>
     * <li><b>Validate:</b> a malformed order is rejected and never touches the
     * book.</li>
     * <li><b>Match:</b> while the best opposite price crosses the limit, trade
     * against the head of that level.</li>
     * <li><b>Rest:</b> any remaining quantity is inserted into the book.</li>
     * </ol>
     * </p>
     */
    public SubmitResult submit(Order order) {
        ValidationResult validation = OrderValidator.validate(order);
        if (validation == ValidationResult.VALID && orderBook.order(order.id()) != null) {
            validation = ValidationResult.DUPLICATE_ORDER_ID;
        }
        if (validation != ValidationResult.VALID) {
            logger.warn("Order rejected " + validation, order.id());
            listener.onOrderRejected(order, validation);
            return SubmitResult.rejected(validation);
        }

        List<Trade> trades = new ArrayList<>(2);
        byte opposite = Side.opposite(order.side());
        while (order.quantity() > 0) {
            PriceLevel best = orderBook.bestLevel(opposite);
            if (best == null || !crosses(order, best.price())) {
                break;
            }
            trades.add(execute(order, best.head()));
        }

        long remaining = order.quantity();
        if (remaining > 0) {
            ValidationResult rest = orderBook.insert(order);
            if (rest != ValidationResult.VALID) {
                throw new IllegalStateException("Remainder of order " + order.id() + " could not rest: " + rest);
            }
            listener.onOrderAccepted(order);
        }
        return SubmitResult.accepted(trades, order.filledQuantity(), remaining);
    }

    private Trade execute(Order incoming, Order resting) {
        long qty = Math.min(incoming.quantity(), resting.quantity());
        long price = resting.price();

        Order buy = incoming.side() == Side.BUY ? incoming : resting;
        Order sell = incoming.side() == Side.BUY ? resting : incoming;
        Trade trade = new Trade(++tradeSequence, price, qty, buy.id(), sell.id(), buy.traderId(), sell.traderId(),
                incoming.side(), incoming.timestamp());

        incoming.reduce(qty);
        orderBook.fill(resting, qty);
        listener.onTrade(trade);
        return trade;
    }

    private static boolean crosses(Order incoming, long restingPrice) {
        return incoming.side() == Side.BUY ? incoming.price() >= restingPrice : incoming.price() <= restingPrice;
    }

    /**
     * Withdraws a resting order.
     *
     * @return false when the order is not resting; the book is left unchanged
     */
    public boolean cancel(long orderId) {
        Order removed = orderBook.remove(orderId);
        if (removed == null) {
            return false;
        }
        listener.onOrderCancelled(removed);
        return true;
    }

    public long tradeCount() {
        return tradeSequence;
    }

    public OrderBook getOrderBook() {
        return orderBook;
    }
}
