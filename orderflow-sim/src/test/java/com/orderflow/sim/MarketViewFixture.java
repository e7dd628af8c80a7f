package com.orderflow.sim;

import com.orderflow.core.Order;
import com.orderflow.core.OrderBook;
import com.orderflow.core.Side;
import com.orderflow.core.Trade;
import com.orderflow.core.ValidationResult;
import com.orderflow.core.logging.NullLogger;

/**
 * Builds {@link MarketView}s over a scratch book for strategy tests.
 */
public final class MarketViewFixture {

    public static final long MIN_PRICE = 1;
    public static final long MAX_PRICE = 200;

    private final OrderBook book = new OrderBook(NullLogger.INSTANCE);
    private final int depth;
    private long nextId;

    public MarketViewFixture() {
        this(3);
    }

    public MarketViewFixture(int depth) {
        this.depth = depth;
    }

    public MarketViewFixture bid(long price, long quantity) {
        return rest(Side.BUY, price, quantity);
    }

    public MarketViewFixture ask(long price, long quantity) {
        return rest(Side.SELL, price, quantity);
    }

    private MarketViewFixture rest(byte side, long price, long quantity) {
        ValidationResult result = book.insert(new Order(++nextId, side, price, quantity, "X" + nextId, nextId));
        if (result != ValidationResult.VALID) {
            throw new IllegalArgumentException("Fixture order refused: " + result);
        }
        return this;
    }

    public MarketView view(long tick, long sessionLength) {
        return view(tick, sessionLength, null);
    }

    public MarketView view(long tick, long sessionLength, Trade lastTrade) {
        return new MarketView(tick, sessionLength, book.bestBid(), book.bestAsk(), book.levels(depth), lastTrade,
                MIN_PRICE, MAX_PRICE);
    }

    public static MarketView empty(long tick, long sessionLength) {
        return new MarketViewFixture().view(tick, sessionLength);
    }

    public static Trade trade(long price, long quantity) {
        return new Trade(1, price, quantity, 1, 2, "XB", "XS", Side.BUY, 0);
    }
}
