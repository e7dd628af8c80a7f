package com.orderflow.sim.trader;

import com.orderflow.core.Side;
import com.orderflow.core.Trade;
import com.orderflow.core.ValidationResult;
import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;
import com.orderflow.sim.MarketView;

import java.util.Random;

/**
 * Bookkeeping shared by all variants: the current assignment, the remaining
 * quantity to work, and the profit booked from fills. Subclasses only price.
 */
public abstract class AbstractTrader implements Trader {

    protected static final Logger LOGGER = new Slf4jLogger(Trader.class);

    private final String id;
    private final TraderType type;
    protected final Random random;

    private CustomerAssignment assignment;
    private long remaining;
    private long balance;
    private int tradeCount;

    protected AbstractTrader(String id, TraderType type, Random random) {
        this.id = id;
        this.type = type;
        this.random = random;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public TraderType type() {
        return type;
    }

    @Override
    public void assign(CustomerAssignment assignment) {
        this.assignment = assignment;
        this.remaining = assignment.quantity();
    }

    @Override
    public CustomerAssignment assignment() {
        return assignment;
    }

    /** Quantity of the current assignment not yet filled. */
    public long remaining() {
        return remaining;
    }

    @Override
    public final Quote decide(MarketView view) {
        if (assignment == null) {
            return null;
        }
        return price(view, assignment);
    }

    /**
     * Prices the current assignment.
     *
     * @return the quote, or null to stay out of the market
     */
    protected abstract Quote price(MarketView view, CustomerAssignment assignment);

    @Override
    public void respond(MarketView view) {
    }

    @Override
    public void onFill(Trade trade, byte side) {
        if (assignment == null || assignment.side() != side) {
            LOGGER.warn("Fill without a matching assignment for " + id, trade.sequence());
            return;
        }
        balance += assignment.profit(trade.price(), trade.quantity());
        tradeCount++;
        remaining -= trade.quantity();
        if (remaining <= 0) {
            assignment = null;
            remaining = 0;
        }
    }

    @Override
    public void onReject(Quote quote, ValidationResult reason) {
        LOGGER.warn(id + " quote rejected " + reason + " at price", quote.price());
    }

    @Override
    public long balance() {
        return balance;
    }

    @Override
    public int tradeCount() {
        return tradeCount;
    }

    protected Quote quote(CustomerAssignment assignment, long price) {
        return new Quote(assignment.side(), price, remaining);
    }

    /** Clamps a price so it never gives away more than the limit allows. */
    protected static long capAtLimit(CustomerAssignment assignment, long price) {
        return assignment.side() == Side.BUY
                ? Math.min(price, assignment.limitPrice())
                : Math.max(price, assignment.limitPrice());
    }

    protected long checkedPrice(double price) {
        if (Double.isNaN(price) || Double.isInfinite(price)) {
            throw new StrategyComputationException(id + " computed a non-finite price: " + price);
        }
        return Math.round(price);
    }

    @Override
    public String toString() {
        return type.code() + "[" + id + ", balance=" + balance + ", trades=" + tradeCount + "]";
    }
}
