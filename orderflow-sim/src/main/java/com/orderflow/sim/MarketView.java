package com.orderflow.sim;

import com.orderflow.core.LevelSnapshot;
import com.orderflow.core.Side;
import com.orderflow.core.TopOfBook;
import com.orderflow.core.Trade;

/**
 * Read-only picture of the market a trader acts on: the clock, the top of
 * book, the aggregated levels and the last trade of the tick.
 */
public final class MarketView {

    private final long tick;
    private final long sessionLength;
    private final TopOfBook bestBid;
    private final TopOfBook bestAsk;
    private final LevelSnapshot levels;
    private final Trade lastTrade;
    private final long minPrice;
    private final long maxPrice;

    public MarketView(long tick, long sessionLength, TopOfBook bestBid, TopOfBook bestAsk, LevelSnapshot levels,
            Trade lastTrade, long minPrice, long maxPrice) {
        this.tick = tick;
        this.sessionLength = sessionLength;
        this.bestBid = bestBid;
        this.bestAsk = bestAsk;
        this.levels = levels;
        this.lastTrade = lastTrade;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
    }

    public long tick() {
        return tick;
    }

    public long sessionLength() {
        return sessionLength;
    }

    /** Fraction of the session still to run, 1.0 at the open falling to 0. */
    public double countdown() {
        return (double) (sessionLength - tick) / sessionLength;
    }

    public TopOfBook bestBid() {
        return bestBid;
    }

    public TopOfBook bestAsk() {
        return bestAsk;
    }

    public TopOfBook best(byte side) {
        return side == Side.BUY ? bestBid : bestAsk;
    }

    public LevelSnapshot levels() {
        return levels;
    }

    /** Last trade printed during the current tick, or null. */
    public Trade lastTrade() {
        return lastTrade;
    }

    public long minPrice() {
        return minPrice;
    }

    public long maxPrice() {
        return maxPrice;
    }

    public boolean hasMidPrice() {
        return !bestBid.isEmpty() && !bestAsk.isEmpty();
    }

    /** Only meaningful when {@link #hasMidPrice()}. */
    public double midPrice() {
        return (bestBid.price() + bestAsk.price()) / 2.0;
    }

    @Override
    public String toString() {
        return "MarketView{t=" + tick + "/" + sessionLength + ", bid=" + bestBid + ", ask=" + bestAsk + '}';
    }
}
