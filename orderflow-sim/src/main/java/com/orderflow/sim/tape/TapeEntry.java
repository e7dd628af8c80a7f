package com.orderflow.sim.tape;

import com.orderflow.core.Order;
import com.orderflow.core.Side;
import com.orderflow.core.Trade;

/**
 * One immutable line of the tape. Trades carry both counterparties; quotes,
 * cancels and rejects carry the one order involved on its own side.
 */
public final class TapeEntry {

    public enum Kind {
        QUOTE,
        TRADE,
        CANCEL,
        REJECT
    }

    private final String sessionId;
    private final long sequence;
    private final long tick;
    private final Kind kind;
    private final long price;
    private final long quantity;
    private final String buyTraderId;
    private final String sellTraderId;
    private final long buyOrderId;
    private final long sellOrderId;

    TapeEntry(String sessionId, long sequence, long tick, Kind kind, long price, long quantity, String buyTraderId,
            String sellTraderId, long buyOrderId, long sellOrderId) {
        this.sessionId = sessionId;
        this.sequence = sequence;
        this.tick = tick;
        this.kind = kind;
        this.price = price;
        this.quantity = quantity;
        this.buyTraderId = buyTraderId;
        this.sellTraderId = sellTraderId;
        this.buyOrderId = buyOrderId;
        this.sellOrderId = sellOrderId;
    }

    static TapeEntry ofTrade(String sessionId, long sequence, long tick, Trade trade) {
        return new TapeEntry(sessionId, sequence, tick, Kind.TRADE, trade.price(), trade.quantity(),
                trade.buyTraderId(), trade.sellTraderId(), trade.buyOrderId(), trade.sellOrderId());
    }

    static TapeEntry ofOrder(String sessionId, long sequence, long tick, Kind kind, Order order) {
        boolean buy = order.side() == Side.BUY;
        return new TapeEntry(sessionId, sequence, tick, kind, order.price(), order.quantity(),
                buy ? order.traderId() : null, buy ? null : order.traderId(),
                buy ? order.id() : 0, buy ? 0 : order.id());
    }

    public String sessionId() {
        return sessionId;
    }

    /** Position on the tape, starting at 1. */
    public long sequence() {
        return sequence;
    }

    public long tick() {
        return tick;
    }

    public Kind kind() {
        return kind;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    /** Null when the entry has no buy side. */
    public String buyTraderId() {
        return buyTraderId;
    }

    public String sellTraderId() {
        return sellTraderId;
    }

    /** 0 when the entry has no buy side. */
    public long buyOrderId() {
        return buyOrderId;
    }

    public long sellOrderId() {
        return sellOrderId;
    }

    @Override
    public String toString() {
        return "TapeEntry{" + sessionId + "#" + sequence + " t=" + tick + " " + kind + " " + quantity + "@" + price
                + " buy=" + buyTraderId + " sell=" + sellTraderId + '}';
    }
}
