package com.orderflow.core;

/**
 * An execution between one buy order and one sell order. Created only by the
 * {@link MatchingEngine}, always at the resting order's price.
 */
public final class Trade {

    private final long sequence;
    private final long price;
    private final long quantity;
    private final long buyOrderId;
    private final long sellOrderId;
    private final String buyTraderId;
    private final String sellTraderId;
    private final byte aggressorSide;
    private final long timestamp;

    public Trade(long sequence, long price, long quantity, long buyOrderId, long sellOrderId,
            String buyTraderId, String sellTraderId, byte aggressorSide, long timestamp) {
        this.sequence = sequence;
        this.price = price;
        this.quantity = quantity;
        this.buyOrderId = buyOrderId;
        this.sellOrderId = sellOrderId;
        this.buyTraderId = buyTraderId;
        this.sellTraderId = sellTraderId;
        this.aggressorSide = aggressorSide;
        this.timestamp = timestamp;
    }

    public long sequence() {
        return sequence;
    }

    public long price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    public long buyOrderId() {
        return buyOrderId;
    }

    public long sellOrderId() {
        return sellOrderId;
    }

    public String buyTraderId() {
        return buyTraderId;
    }

    public String sellTraderId() {
        return sellTraderId;
    }

    public byte aggressorSide() {
        return aggressorSide;
    }

    public long timestamp() {
        return timestamp;
    }

    /** Order id on the given side of this trade. */
    public long orderId(byte side) {
        return side == Side.BUY ? buyOrderId : sellOrderId;
    }

    public String traderId(byte side) {
        return side == Side.BUY ? buyTraderId : sellTraderId;
    }

    @Override
    public String toString() {
        return "Trade{" +
                "seq=" + sequence +
                ", " + quantity + "@" + price +
                ", buy=" + buyOrderId + "/" + buyTraderId +
                ", sell=" + sellOrderId + "/" + sellTraderId +
                ", t=" + timestamp +
                '}';
    }
}
