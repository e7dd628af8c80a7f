package com.orderflow.core;

import java.util.Arrays;

/**
 * Aggregated price levels of both sides at one book revision, best first.
 * <p>
 * Reads past the resting depth return price 0 and quantity 0, so consumers
 * can ask for any level without bounds checks.
 * </p>
 */
public final class LevelSnapshot {

    private final long revision;
    private final long[] bidPrices;
    private final long[] bidQuantities;
    private final long[] askPrices;
    private final long[] askQuantities;

    public LevelSnapshot(long revision, long[] bidPrices, long[] bidQuantities, long[] askPrices,
            long[] askQuantities) {
        if (bidPrices.length != bidQuantities.length || askPrices.length != askQuantities.length) {
            throw new IllegalArgumentException("price and quantity arrays differ in length");
        }
        this.revision = revision;
        this.bidPrices = bidPrices.clone();
        this.bidQuantities = bidQuantities.clone();
        this.askPrices = askPrices.clone();
        this.askQuantities = askQuantities.clone();
    }

    public long revision() {
        return revision;
    }

    public int bidDepth() {
        return bidPrices.length;
    }

    public int askDepth() {
        return askPrices.length;
    }

    public int depth(byte side) {
        return side == Side.BUY ? bidDepth() : askDepth();
    }

    /** Zero-based level index. */
    public long bidPrice(int level) {
        return level < bidPrices.length ? bidPrices[level] : 0;
    }

    public long bidQuantity(int level) {
        return level < bidQuantities.length ? bidQuantities[level] : 0;
    }

    public long askPrice(int level) {
        return level < askPrices.length ? askPrices[level] : 0;
    }

    public long askQuantity(int level) {
        return level < askQuantities.length ? askQuantities[level] : 0;
    }

    public long price(byte side, int level) {
        return side == Side.BUY ? bidPrice(level) : askPrice(level);
    }

    public long quantity(byte side, int level) {
        return side == Side.BUY ? bidQuantity(level) : askQuantity(level);
    }

    public boolean isEmpty(byte side) {
        return depth(side) == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LevelSnapshot)) {
            return false;
        }
        LevelSnapshot that = (LevelSnapshot) o;
        return revision == that.revision
                && Arrays.equals(bidPrices, that.bidPrices)
                && Arrays.equals(bidQuantities, that.bidQuantities)
                && Arrays.equals(askPrices, that.askPrices)
                && Arrays.equals(askQuantities, that.askQuantities);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(revision);
        result = 31 * result + Arrays.hashCode(bidPrices);
        result = 31 * result + Arrays.hashCode(bidQuantities);
        result = 31 * result + Arrays.hashCode(askPrices);
        result = 31 * result + Arrays.hashCode(askQuantities);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LevelSnapshot{rev=").append(revision).append(", bids=[");
        appendLevels(sb, bidPrices, bidQuantities);
        sb.append("], asks=[");
        appendLevels(sb, askPrices, askQuantities);
        return sb.append("]}").toString();
    }

    private static void appendLevels(StringBuilder sb, long[] prices, long[] quantities) {
        for (int i = 0; i < prices.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(quantities[i]).append('@').append(prices[i]);
        }
    }
}
